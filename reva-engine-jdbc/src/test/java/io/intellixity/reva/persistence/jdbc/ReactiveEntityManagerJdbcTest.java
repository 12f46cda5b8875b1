package io.intellixity.reva.persistence.jdbc;

import io.intellixity.reva.persistence.connection.Connection;
import io.intellixity.reva.persistence.connection.ConnectionOptions;
import io.intellixity.reva.persistence.connection.Connections;
import io.intellixity.reva.persistence.exec.QueryResult;
import io.intellixity.reva.persistence.manager.EntityManagerReleasedException;
import io.intellixity.reva.persistence.manager.ReactiveEntityManager;
import io.intellixity.reva.persistence.repository.InMemoryRepositoryResolver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/** Managers over a real JDBC connection (SQLite file database). */
final class ReactiveEntityManagerJdbcTest {
  private static final Duration TIMEOUT = Duration.ofSeconds(10);

  @TempDir Path dir;
  private Connection connection;

  @BeforeEach
  void setUp() {
    ConnectionOptions o = ConnectionOptions.of("jdbc", "jdbc:sqlite:" + dir.resolve("em.db"))
        .withName("em")
        .withMaxPoolSize(2);
    connection = Connections.open(o, new InMemoryRepositoryResolver());
    connection.createEntityManager(false)
        .query("CREATE TABLE account (id INTEGER PRIMARY KEY, balance INTEGER NOT NULL)")
        .block(TIMEOUT);
  }

  @AfterEach
  void tearDown() {
    connection.close();
  }

  private static long count(ReactiveEntityManager em) {
    QueryResult r = em.query("SELECT count(*) AS n FROM account").block(TIMEOUT);
    return ((Number) r.rows().get(0).get("n")).longValue();
  }

  @Test
  void perCallQueries_seeEachOthersWrites() {
    ReactiveEntityManager em = connection.createEntityManager(false);
    StepVerifier.create(em.query("INSERT INTO account (id, balance) VALUES (1, 10)"))
        .assertNext(r -> assertEquals(1, r.updateCount()))
        .expectComplete()
        .verify(TIMEOUT);
    assertEquals(1, count(em));
  }

  @Test
  void singleConnectionTransaction_commits() {
    ReactiveEntityManager em = connection.createIsolatedEntityManager();

    Mono<String> tx = em.transaction(() -> em.query("INSERT INTO account (id, balance) VALUES (1, 10)")
        .then(em.query("INSERT INTO account (id, balance) VALUES (2, 20)"))
        .thenReturn("done"));

    StepVerifier.create(tx).expectNext("done").expectComplete().verify(TIMEOUT);
    assertEquals(2, count(em));

    em.release().block(TIMEOUT);
    assertEquals(2, count(connection.createEntityManager(false)));
  }

  @Test
  void singleConnectionTransaction_rollsBackOnError() {
    ReactiveEntityManager em = connection.createIsolatedEntityManager();
    IllegalStateException boom = new IllegalStateException("boom");

    Mono<Object> tx = em.transaction(() -> em.query("INSERT INTO account (id, balance) VALUES (1, 10)")
        .then(Mono.error(boom)));

    StepVerifier.create(tx).expectErrorSatisfies(e -> assertSame(boom, e)).verify(TIMEOUT);
    assertEquals(0, count(em));
    em.release().block(TIMEOUT);
  }

  @Test
  void failingStatement_rollsBackEarlierStatements() {
    ReactiveEntityManager em = connection.createIsolatedEntityManager();

    Mono<QueryResult> tx = em.transaction(() -> em.query("INSERT INTO account (id, balance) VALUES (1, 10)")
        .then(em.query("INSERT INTO account (id, balance) VALUES (1, 99)")));

    StepVerifier.create(tx).expectError(JdbcExecutionException.class).verify(TIMEOUT);
    assertEquals(0, count(em));
    em.release().block(TIMEOUT);
  }

  @Test
  void releasedIsolatedManager_rejectsWork_andReleaseIsIdempotent() {
    ReactiveEntityManager em = connection.createIsolatedEntityManager();
    assertEquals(0, count(em));

    em.release().block(TIMEOUT);
    em.release().block(TIMEOUT);
    assertTrue(em.isReleased());

    StepVerifier.create(em.query("SELECT 1")).expectError(EntityManagerReleasedException.class).verify(TIMEOUT);
  }
}
