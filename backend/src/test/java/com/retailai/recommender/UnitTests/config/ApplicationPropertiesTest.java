package com.retailai.recommender.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import com.retailai.recommender.dto.embedding.Modality;

@DisplayName("ApplicationProperties Tests")
class ApplicationPropertiesTest {

  @Test
  @DisplayName("Should provide documented defaults")
  void defaults() {
    ApplicationProperties properties = new ApplicationProperties();

    assertThat(properties.getIndex().getNumLists()).isEqualTo(100);
    assertThat(properties.getIndex().getNumProbes()).isEqualTo(10);
    assertThat(properties.getIndex().getMaxInsertFraction()).isEqualTo(0.1);
    assertThat(properties.getRecommendation().getDefaultK()).isEqualTo(5);
    assertThat(properties.getRecommendation().getDistanceThreshold()).isNull();
    assertThat(properties.getRetry().getMaxAttempts()).isEqualTo(3);
    assertThat(properties.getRefresh().getModalities())
        .containsExactly(Modality.TEXT, Modality.IMAGE);
  }

  @Test
  @DisplayName("Should pick the dimension by modality")
  void dimensionFor() {
    ApplicationProperties properties = new ApplicationProperties();
    properties.getEmbedding().setTextDimension(384);
    properties.getEmbedding().setImageDimension(512);

    assertThat(properties.dimensionFor(Modality.TEXT)).isEqualTo(384);
    assertThat(properties.dimensionFor(Modality.IMAGE)).isEqualTo(512);
  }

  @Test
  @DisplayName("Should bind kebab-case engine properties")
  void binds() {
    MapConfigurationPropertySource source = new MapConfigurationPropertySource();
    source.put("engine.index.num-lists", "64");
    source.put("engine.index.max-snapshot-age", "PT30M");
    source.put("engine.recommendation.distance-threshold", "0.4");
    source.put("engine.refresh.modalities", "TEXT");

    ApplicationProperties properties =
        new Binder(source).bind("engine", ApplicationProperties.class).get();

    assertThat(properties.getIndex().getNumLists()).isEqualTo(64);
    assertThat(properties.getIndex().getMaxSnapshotAge()).isEqualTo(Duration.ofMinutes(30));
    assertThat(properties.getRecommendation().getDistanceThreshold()).isEqualTo(0.4);
    assertThat(properties.getRefresh().getModalities()).containsExactly(Modality.TEXT);
  }
}
