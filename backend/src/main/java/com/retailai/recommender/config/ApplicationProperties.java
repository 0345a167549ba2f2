package com.retailai.recommender.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import com.retailai.recommender.dto.embedding.Modality;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "engine")
public class ApplicationProperties {

  private Embedding embedding = new Embedding();
  private Index index = new Index();
  private Recommendation recommendation = new Recommendation();
  private Quality quality = new Quality();
  private Refresh refresh = new Refresh();
  private Retry retry = new Retry();

  /** Configured vector length for a modality. */
  public int dimensionFor(Modality modality) {
    return modality == Modality.IMAGE
        ? embedding.getImageDimension()
        : embedding.getTextDimension();
  }

  @Data
  public static class Embedding {
    private int textDimension = 1024;
    private int imageDimension = 1024;
    /** Superseded versions kept per (item, modality) for audit and rollback. */
    private int retentionVersions = 3;
    /** JSON file the store is persisted to; blank keeps the store in memory only. */
    private String storeFile;
  }

  @Data
  public static class Index {
    private int numLists = 100;
    private int numProbes = 10;
    private int kmeansIterations = 10;
    /** Incremental inserts allowed, as a fraction of the indexed size, before a full build. */
    private double maxInsertFraction = 0.1;
    private Duration maxSnapshotAge = Duration.ofHours(1);
    private long seed = 42L;
    private double recallTarget = 0.95;
  }

  @Data
  public static class Recommendation {
    private int defaultK = 5;
    private int maxK = 100;
    /** Results farther than this cosine distance are dropped; null disables the cutoff. */
    private Double distanceThreshold;
    private boolean explanationsEnabled = true;
    private Duration explanationTimeout = Duration.ofSeconds(2);
    private Modality defaultModality = Modality.TEXT;
  }

  @Data
  public static class Quality {
    private double highRiskMaxRating = 3.0;
    private int mediumRiskMinNegative = 5;
    private double mediumRiskMaxRating = 3.5;
    private double monitorMaxRating = 4.0;
    /** Reviews without sentiment count as positive at or above this rating. */
    private int positiveMinRating = 4;
    /** Reviews without sentiment count as negative at or below this rating. */
    private int negativeMaxRating = 2;
    private boolean explanationsEnabled = true;
  }

  @Data
  public static class Refresh {
    private int workerThreads = 8;
    private Duration itemTimeout = Duration.ofSeconds(30);
    private boolean scheduleEnabled;
    private Duration interval = Duration.ofMinutes(15);
    private List<Modality> modalities = new ArrayList<>(List.of(Modality.TEXT, Modality.IMAGE));
  }

  @Data
  public static class Retry {
    private int maxAttempts = 3;
    private long backoffMs = 500;
    private long maxBackoffMs = 8000;
    private double multiplier = 2.0;
  }
}
