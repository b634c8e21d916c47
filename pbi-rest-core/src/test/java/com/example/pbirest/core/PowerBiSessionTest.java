package com.example.pbirest.core;

import static com.example.pbirest.core.http.StubTransport.ok;
import static org.junit.jupiter.api.Assertions.*;

import com.example.pbirest.core.auth.Credential;
import com.example.pbirest.core.http.StubTransport;
import com.example.pbirest.core.resources.Dataset;
import com.example.pbirest.core.resources.Group;
import com.example.pbirest.core.resources.Page;
import com.example.pbirest.core.resources.Schedule;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

class PowerBiSessionTest {

  private static final String GROUPS =
      "{\"value\":[{\"id\":\"g1\",\"name\":\"Finance\"},{\"id\":\"g2\",\"name\":\"Sales\"}]}";

  private StubTransport transport;
  private PowerBiSession session;

  @BeforeEach
  void setUp() {
    transport = new StubTransport();
    final var client =
        PowerBiClient.builder()
            .credential(Credential.staticToken("test-token"))
            .settings(PowerBiSettings.defaults().withBaseUrl(StubTransport.BASE_URL))
            .clock(new MutableClock(Instant.parse("2024-05-01T12:00:00Z")))
            .transportFactory(() -> transport)
            .build();
    session = client.openSession();
    transport.on("GET", "/groups", ok(GROUPS));
  }

  private static String datasets(final String prefix, final int count) {
    return IntStream.range(0, count)
        .mapToObj(i -> "{\"id\":\"" + prefix + i + "\",\"name\":\"" + prefix + "-ds" + i + "\"}")
        .collect(Collectors.joining(",", "{\"value\":[", "]}"));
  }

  @Nested
  @DisplayName("Listing")
  class Listing {

    @Test
    @DisplayName("Datasets across two groups come back group by group, tagged with the group")
    void shouldListDatasetsAcrossGroups() {
      transport.on("GET", "/groups/g1/datasets", ok(datasets("a", 5)));
      transport.on("GET", "/groups/g2/datasets", ok(datasets("b", 3)));

      final var datasets =
          session.listGroups().flatMap(session::listDatasets).block();

      assertEquals(8, datasets.size());
      assertEquals(
          List.of("a0", "a1", "a2", "a3", "a4", "b0", "b1", "b2"),
          datasets.stream().map(Dataset::id).toList());
      assertEquals(
          List.of("g1", "g1", "g1", "g1", "g1", "g2", "g2", "g2"),
          datasets.stream().map(Dataset::groupId).toList());
      assertEquals("Finance", datasets.get(0).group().name());
    }

    @Test
    @DisplayName("Results follow group order even when the first group answers last")
    void shouldKeepGroupOrderWhenResponsesArriveOutOfOrder() {
      transport.on("GET", "/groups/g1/datasets", ok(datasets("a", 2)));
      transport.on("GET", "/groups/g2/datasets", ok(datasets("b", 1)));
      transport.delay("GET", "/groups/g1/datasets", Duration.ofMillis(300));

      final var datasets =
          session
              .listGroups()
              .flatMap(groups -> session.listDatasets(groups.get(0), groups.get(1)))
              .block(Duration.ofSeconds(5));

      assertEquals(List.of("a0", "a1", "b0"), datasets.stream().map(Dataset::id).toList());
      assertEquals(2, transport.requests("GET", "/datasets").size());
    }

    @Test
    @DisplayName("Pages across reports keep report order")
    void shouldListPages() {
      transport.on(
          "GET",
          "/groups/g1/reports",
          ok("{\"value\":[{\"id\":\"r1\",\"name\":\"One\"},{\"id\":\"r2\",\"name\":\"Two\"}]}"));
      transport.on(
          "GET",
          "/groups/g1/reports/r1/pages",
          ok("{\"value\":[{\"name\":\"S1\",\"displayName\":\"Intro\",\"order\":0}]}"));
      transport.on(
          "GET",
          "/groups/g1/reports/r2/pages",
          ok("{\"value\":[{\"name\":\"S2\",\"displayName\":\"Detail\",\"order\":1}]}"));

      final var pages =
          session
              .findGroup("Finance")
              .flatMap(session::listReports)
              .flatMap(session::listPages)
              .block();

      assertEquals(List.of("Intro", "Detail"), pages.stream().map(Page::name).toList());
      assertEquals("r2", pages.get(1).report().id());
    }

    @Test
    @DisplayName("Dataflows and their transactions are listed per group")
    void shouldListDataflowTransactions() {
      transport.on(
          "GET",
          "/groups/g2/dataflows",
          ok("{\"value\":[{\"objectId\":\"f1\",\"name\":\"Ingest\"}]}"));
      transport.on(
          "GET",
          "/groups/g2/dataflows/f1/transactions",
          ok("{\"value\":["
              + "{\"id\":\"t2\",\"startTime\":\"2024-05-02T00:00:00Z\",\"status\":\"Success\"},"
              + "{\"id\":\"t1\",\"startTime\":\"2024-05-01T00:00:00Z\",\"status\":\"Failed\"}]}"));

      final var transactions =
          session
              .findGroup("Sales")
              .flatMap(group -> session.findDataflow(group, "Ingest"))
              .flatMap(session::listTransactions)
              .block();

      assertEquals(List.of("t1", "t2"), transactions.stream().map(t -> t.id()).toList());
      assertEquals("f1", transactions.get(0).dataflow().id());
    }
  }

  @Nested
  @DisplayName("Lookups")
  class Lookups {

    @Test
    @DisplayName("Missing names raise NotFoundException")
    void shouldRaiseNotFound() {
      transport.on("GET", "/groups/g1/datasets", ok(datasets("a", 2)));

      StepVerifier.create(session.findGroup("Marketing"))
          .expectErrorSatisfies(
              error -> {
                assertInstanceOf(NotFoundException.class, error);
                assertEquals("group", ((NotFoundException) error).kind());
                assertEquals("Marketing", ((NotFoundException) error).lookup());
              })
          .verify();
      StepVerifier.create(
              session.findGroup("Finance").flatMap(g -> session.findDataset(g, "nope")))
          .expectError(NotFoundException.class)
          .verify();
    }

    @Test
    @DisplayName("Existing names resolve")
    void shouldFindByName() {
      transport.on("GET", "/groups/g1/datasets", ok(datasets("a", 2)));

      final Group group = session.findGroup("Finance").block();
      final var dataset = session.findDataset(group, "a-ds1").block();

      assertEquals("a1", dataset.id());
      assertEquals("g1", dataset.groupId());
    }
  }

  @Nested
  @DisplayName("Schedules")
  class Schedules {

    @Test
    @DisplayName("Schedule is read as a bare object and written in a value envelope")
    void shouldReadAndWriteSchedule() {
      transport.on("GET", "/groups/g1/datasets", ok(datasets("a", 1)));
      transport.on(
          "GET",
          "/groups/g1/datasets/a0/refreshSchedule",
          ok("{\"@odata.context\":\"x\",\"days\":[\"Monday\"],\"times\":[\"06:00\"],"
              + "\"enabled\":true,\"localTimeZoneId\":\"UTC\","
              + "\"notifyOption\":\"NoNotification\"}"));
      transport.on("PATCH", "/groups/g1/datasets/a0/refreshSchedule", ok(""));

      final var dataset =
          session.findGroup("Finance").flatMap(g -> session.findDataset(g, "a-ds0")).block();
      final var schedule = session.getSchedule(dataset).block();

      assertEquals(List.of("Monday"), schedule.days());
      assertEquals("a0", schedule.id());

      final var updated = Schedule.of(List.of("Tuesday"), List.of("08:30"), false);
      session.setSchedule(dataset, updated).block();

      final var patch =
          transport.requests("PATCH", "/groups/g1/datasets/a0/refreshSchedule").get(0);
      assertTrue(patch.body().startsWith("{\"value\":{\"days\":[\"Tuesday\"]"));
    }
  }

  @Test
  @DisplayName("Closing the session closes its transport")
  void shouldCloseTransport() {
    session.listGroups().block();

    session.close();

    assertTrue(transport.isClosed());
  }
}
