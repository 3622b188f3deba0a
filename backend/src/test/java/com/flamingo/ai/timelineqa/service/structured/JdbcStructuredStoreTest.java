package com.flamingo.ai.timelineqa.service.structured;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.timelineqa.config.QaConfig;
import com.flamingo.ai.timelineqa.exception.QueryGenerationException;
import com.flamingo.ai.timelineqa.exception.QueryGenerationException.Reason;
import com.flamingo.ai.timelineqa.support.TestViews;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JdbcStructuredStoreTest {

  @TempDir Path tempDir;

  private SimpleMeterRegistry meterRegistry;
  private JdbcStructuredStore store;
  private StructuredView books;

  @BeforeEach
  void setUp() throws SQLException {
    String url = "jdbc:sqlite:" + tempDir.resolve("views.db");
    try (Connection connection = DriverManager.getConnection(url);
        Statement statement = connection.createStatement()) {
      statement.execute("CREATE TABLE books (date TEXT, title TEXT, author TEXT, price REAL)");
      statement.execute(
          "INSERT INTO books VALUES"
              + " ('2024-04-03', 'The Dispossessed', 'Le Guin', 12.5),"
              + " ('2024-04-19', 'Piranesi', 'Clarke', 9.0),"
              + " ('2024-05-02', 'Middlemarch', 'Eliot', 7.25)");
    }

    QaConfig qaConfig = TestViews.withBooks();
    qaConfig.getStructured().setJdbcUrl(url);
    qaConfig.getStructured().setMaxRows(2);
    meterRegistry = new SimpleMeterRegistry();
    store = new JdbcStructuredStore(qaConfig, meterRegistry);
    books = new StructuredViewRegistry(qaConfig).find("books").orElseThrow();
  }

  @Test
  @DisplayName("should return column labels and rows")
  void shouldExecuteAggregate() {
    TabularResult result =
        store.execute(
            new ValidatedQuery(
                books,
                "SELECT COUNT(*) AS book_count FROM books"
                    + " WHERE date >= '2024-04-01' AND date < '2024-05-01'"));

    assertThat(result.columns()).containsExactly("book_count");
    assertThat(result.isScalar()).isTrue();
    assertThat(((Number) result.rows().get(0).get(0)).intValue()).isEqualTo(2);
    assertThat(result.truncated()).isFalse();
    assertThat(meterRegistry.counter("structured.query.executed").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should cap rows and flag the result as truncated")
  void shouldTruncateAtMaxRows() {
    TabularResult result =
        store.execute(new ValidatedQuery(books, "SELECT title FROM books ORDER BY date"));

    assertThat(result.rows())
        .containsExactly(List.of("The Dispossessed"), List.of("Piranesi"));
    assertThat(result.truncated()).isTrue();
  }

  @Test
  @DisplayName("should not flag a result that fits exactly")
  void shouldNotTruncateExactFit() {
    TabularResult result =
        store.execute(
            new ValidatedQuery(books, "SELECT title FROM books WHERE price > 8 ORDER BY date"));

    assertThat(result.rows()).hasSize(2);
    assertThat(result.truncated()).isFalse();
  }

  @Test
  @DisplayName("should refuse writes on the read-only connection")
  void shouldRefuseWrites() {
    assertThatThrownBy(
            () ->
                store.execute(
                    new ValidatedQuery(
                        books, "INSERT INTO books VALUES ('2024-06-01', 'x', 'y', 1.0)")))
        .isInstanceOf(QueryGenerationException.class)
        .hasFieldOrPropertyWithValue("reason", Reason.EXECUTION_FAILED);
  }

  @Test
  @DisplayName("should map store errors to execution failures")
  void shouldMapStoreErrors() {
    assertThatThrownBy(
            () -> store.execute(new ValidatedQuery(books, "SELECT isbn FROM books")))
        .isInstanceOf(QueryGenerationException.class)
        .hasFieldOrPropertyWithValue("reason", Reason.EXECUTION_FAILED);
    assertThat(meterRegistry.counter("structured.query.execution_failed").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("should report which views exist in the store")
  void shouldCheckViews() {
    assertThat(store.viewExists("books")).isTrue();
    assertThat(store.viewExists("trips")).isFalse();
  }
}
