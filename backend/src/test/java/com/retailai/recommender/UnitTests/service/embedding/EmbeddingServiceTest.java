package com.retailai.recommender.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.retailai.recommender.dto.embedding.Embedding;
import com.retailai.recommender.dto.embedding.Modality;
import com.retailai.recommender.dto.refresh.IndexAction;
import com.retailai.recommender.exception.DimensionMismatchException;
import com.retailai.recommender.exception.ItemNotFoundException;
import com.retailai.recommender.fixtures.TestVectors;
import com.retailai.recommender.service.index.IndexManager;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingService Tests")
class EmbeddingServiceTest {

  @Mock private EmbeddingStore embeddingStore;

  @Mock private IndexManager indexManager;

  @InjectMocks private EmbeddingService embeddingService;

  @Test
  @DisplayName("Should commit to the store before updating the index")
  void upsertCommitsThenIndexes() {
    // Given
    float[] vector = TestVectors.of(1, 0, 0, 0);
    Embedding stored = TestVectors.embedding("sku-1", Modality.TEXT, vector);
    when(embeddingStore.upsert("sku-1", Modality.TEXT, vector)).thenReturn(stored);
    when(indexManager.applyChanges(eq(Modality.TEXT), anyMap()))
        .thenReturn(IndexAction.INCREMENTAL_INSERT);

    // When
    Embedding result = embeddingService.upsert("sku-1", Modality.TEXT, vector);

    // Then
    assertThat(result).isSameAs(stored);
    InOrder order = inOrder(embeddingStore, indexManager);
    order.verify(embeddingStore).upsert("sku-1", Modality.TEXT, vector);
    order.verify(indexManager).applyChanges(Modality.TEXT, Map.of("sku-1", stored.vectorView()));
    order.verify(embeddingStore).persist();
  }

  @Test
  @DisplayName("Should leave the index alone when the store rejects the vector")
  void rejectedWriteSkipsIndex() {
    // Given
    when(embeddingStore.upsert(eq("sku-1"), eq(Modality.TEXT), any()))
        .thenThrow(new DimensionMismatchException(4, 2));

    // When / Then
    assertThatThrownBy(() -> embeddingService.upsert("sku-1", Modality.TEXT, new float[2]))
        .isInstanceOf(DimensionMismatchException.class);
    verifyNoInteractions(indexManager);
    verify(embeddingStore, never()).persist();
  }

  @Test
  @DisplayName("Should throw ItemNotFoundException when there is no history")
  void historyMissing() {
    // Given
    when(embeddingStore.history("sku-9", Modality.IMAGE)).thenReturn(Optional.empty());

    // When / Then
    assertThatThrownBy(() -> embeddingService.history("sku-9", Modality.IMAGE))
        .isInstanceOf(ItemNotFoundException.class)
        .hasMessageContaining("sku-9");
  }

  @Test
  @DisplayName("Should re-index the reinstated version after a rollback")
  void rollbackReindexes() {
    // Given
    Embedding reinstated = TestVectors.embedding("sku-1", Modality.TEXT, TestVectors.of(0, 1));
    when(embeddingStore.rollback("sku-1", Modality.TEXT)).thenReturn(reinstated);
    when(indexManager.applyChanges(eq(Modality.TEXT), anyMap()))
        .thenReturn(IndexAction.INCREMENTAL_INSERT);

    // When
    Embedding result = embeddingService.rollback("sku-1", Modality.TEXT);

    // Then
    assertThat(result).isSameAs(reinstated);
    verify(indexManager).applyChanges(Modality.TEXT, Map.of("sku-1", reinstated.vectorView()));
    verify(embeddingStore).persist();
  }
}
