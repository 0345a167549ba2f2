package com.retailai.recommender.service.refresh;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.retailai.recommender.config.ApplicationProperties;
import com.retailai.recommender.dto.embedding.Modality;
import com.retailai.recommender.fixtures.TestFixtures;
import com.retailai.recommender.fixtures.TestFixtures.MutableClock;
import com.retailai.recommender.fixtures.TestVectors;
import com.retailai.recommender.service.embedding.EmbeddingStore;
import com.retailai.recommender.service.embedding.VersionedEmbeddingStore;
import com.retailai.recommender.service.index.IndexManager;
import com.retailai.recommender.service.index.IndexSnapshot;
import com.retailai.recommender.service.index.VectorIndexService;

@DisplayName("IndexBootstrapService Tests")
class IndexBootstrapServiceTest {

  private static final int DIM = 8;

  @Test
  @DisplayName("Should build indexes for modalities with stored embeddings only")
  void buildsStoredModalities() {
    // Given
    ApplicationProperties properties = TestFixtures.properties(DIM);
    MutableClock clock = new MutableClock(TestFixtures.T0);
    VersionedEmbeddingStore store =
        new VersionedEmbeddingStore(new ObjectMapper(), properties, clock);
    IndexManager indexManager =
        new IndexManager(new VectorIndexService(properties, clock), store, properties, clock);
    for (int i = 0; i < 20; i++) {
      String id = TestVectors.itemId(i);
      store.upsert(id, Modality.TEXT, TestVectors.forKey(id, DIM));
    }

    // When
    new IndexBootstrapService(store, indexManager).buildIndexesOnStartup();

    // Then
    IndexSnapshot text = indexManager.current(Modality.TEXT);
    assertThat(text.isBuilt()).isTrue();
    assertThat(text.size()).isEqualTo(20);
    assertThat(indexManager.current(Modality.IMAGE).isBuilt()).isFalse();
  }

  @Test
  @DisplayName("Should keep starting up when one modality fails to build")
  void survivesBuildFailure() {
    // Given
    EmbeddingStore store = mock(EmbeddingStore.class);
    IndexManager indexManager = mock(IndexManager.class);
    when(store.size(Modality.TEXT)).thenReturn(5);
    when(store.size(Modality.IMAGE)).thenReturn(0);
    when(indexManager.rebuild(Modality.TEXT)).thenThrow(new IllegalStateException("corrupt"));

    // When
    new IndexBootstrapService(store, indexManager).buildIndexesOnStartup();

    // Then
    verify(indexManager).rebuild(Modality.TEXT);
    verify(indexManager, never()).rebuild(Modality.IMAGE);
  }
}
