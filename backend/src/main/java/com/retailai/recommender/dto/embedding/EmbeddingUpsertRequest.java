package com.retailai.recommender.dto.embedding;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddingUpsertRequest {

  @NotNull private float[] vector;
}
