package com.flamingo.ai.timelineqa.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the timeline question-answering pipeline. */
@Configuration
@ConfigurationProperties(prefix = "qa")
@Getter
@Setter
public class QaConfig {

  private Ingestion ingestion = new Ingestion();
  private Index index = new Index();
  private Retrieval retrieval = new Retrieval();
  private Structured structured = new Structured();
  private Router router = new Router();
  private General general = new General();

  @Getter
  @Setter
  public static class Ingestion {
    /** Zone applied to timestamps that carry no offset. */
    private String defaultZone = "UTC";
  }

  @Getter
  @Setter
  public static class Index {
    private String cacheDir = "data/index-cache";

    /** Identifies the embedding function; a cache built with another model is discarded. */
    private String embeddingModelId = "text-embedding-3-small";

    private int embeddingBatchSize = 64;
    private long staleWaitMs = 10000;
    private int retainedCacheFiles = 3;
    private boolean buildOnStartup = true;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int defaultTopK = 10;
    private int maxTopK = 50;
    private double minSimilarity = 0.25;
    private double similarityWeight = 0.7;
    private double coverageWeight = 0.3;
    private double malformedConfidencePenalty = 0.5;
    private boolean temporalFilterEnabled = true;
    private int relatedTopK = 5;
    private int temporalWindowDays = 30;
  }

  @Getter
  @Setter
  public static class Structured {
    private String jdbcUrl = "jdbc:sqlite:data/views.db";
    private int maxRows = 200;
    private int queryTimeoutSeconds = 5;
    private double confidence = 0.9;
    private double emptyResultConfidence = 0.6;
    private List<View> views = new ArrayList<>();

    @Getter
    @Setter
    public static class View {
      private String name;
      private String description;
      private List<Column> columns = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Column {
      private String name;
      private String type = "TEXT";
      private String description;
    }
  }

  @Getter
  @Setter
  public static class Router {
    private long structuredTimeoutMs = 30000;
    private long retrievalTimeoutMs = 45000;
    private long generalTimeoutMs = 30000;
    private int auditCapacity = 200;

    /**
     * When retrieval is down for a personal question, answer through the general engine with an
     * explicit inability message instead of failing.
     */
    private boolean degradedGeneralForPersonal = true;
  }

  @Getter
  @Setter
  public static class General {
    private double confidence = 0.3;
  }
}
