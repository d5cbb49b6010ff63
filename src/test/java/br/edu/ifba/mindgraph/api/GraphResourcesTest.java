package br.edu.ifba.mindgraph.api;

import br.edu.ifba.mindgraph.core.EntityType;
import br.edu.ifba.mindgraph.core.KnowledgeEdge;
import br.edu.ifba.mindgraph.core.KnowledgeNode;
import br.edu.ifba.mindgraph.shared.UuidUtils;
import br.edu.ifba.mindgraph.storage.GraphStore;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.startsWith;

/**
 * Tests of the graph read, export and maintenance endpoints.
 */
@QuarkusTest
class GraphResourcesTest {

    @Inject
    GraphStore graphStore;

    private String profileId;
    private KnowledgeNode sarah;
    private KnowledgeNode yoga;

    @BeforeEach
    void setUp() {
        profileId = "p-" + UUID.randomUUID();
        Instant now = Instant.now();
        sarah = graphStore.upsertNode(node(EntityType.PERSON, "Sarah", 4, now.minusSeconds(3600))).join();
        yoga = graphStore.upsertNode(node(EntityType.ACTIVITY, "yoga", 1, now)).join();
        graphStore.upsertEdge(KnowledgeEdge.builder()
            .id(UuidUtils.newId())
            .profileId(profileId)
            .sourceNodeId(sarah.getId())
            .targetNodeId(yoga.getId())
            .relationshipType("enjoys")
            .confidence(0.7)
            .lastUpdated(now)
            .build()).join();
    }

    private KnowledgeNode node(EntityType type, String name, int mentions, Instant at) {
        return KnowledgeNode.builder()
            .id(UuidUtils.newId())
            .profileId(profileId)
            .entityType(type)
            .entityName(name)
            .canonicalName(name.toLowerCase())
            .confidence(0.8)
            .mentionCount(mentions)
            .lastMentioned(at)
            .build();
    }

    @Test
    void testListNodesByRecency() {
        given()
        .when()
            .get("/api/v1/profiles/{profileId}/graph/nodes", profileId)
        .then()
            .statusCode(200)
            .body("size()", equalTo(2))
            .body("[0].entity_name", equalTo("yoga"));
    }

    @Test
    void testListNodesFilteredByType() {
        given()
            .queryParam("type", "Person")
        .when()
            .get("/api/v1/profiles/{profileId}/graph/nodes", profileId)
        .then()
            .statusCode(200)
            .body("size()", equalTo(1))
            .body("[0].entity_name", equalTo("Sarah"));
    }

    @Test
    void testUnknownTypeOrOrderIsRejected() {
        given().queryParam("type", "planet")
            .get("/api/v1/profiles/{profileId}/graph/nodes", profileId)
            .then().statusCode(400);
        given().queryParam("order", "random")
            .get("/api/v1/profiles/{profileId}/graph/nodes", profileId)
            .then().statusCode(400);
    }

    @Test
    void testGetMissingNodeIs404() {
        given()
        .when()
            .get("/api/v1/profiles/{profileId}/graph/nodes/{nodeId}", profileId, "missing")
        .then()
            .statusCode(404);
    }

    @Test
    void testListEdgesResolvesSynonyms() {
        given()
            .queryParam("type", "likes")
        .when()
            .get("/api/v1/profiles/{profileId}/graph/edges", profileId)
        .then()
            .statusCode(200)
            .body("size()", equalTo(1))
            .body("[0].relationship_type", equalTo("enjoys"));
    }

    @Test
    void testStats() {
        given()
        .when()
            .get("/api/v1/profiles/{profileId}/graph/stats", profileId)
        .then()
            .statusCode(200)
            .body("node_count", equalTo(2))
            .body("edge_count", equalTo(1));
    }

    @Test
    void testExportAsCsv() {
        given()
            .queryParam("format", "csv")
        .when()
            .get("/api/v1/profiles/{profileId}/graph/export", profileId)
        .then()
            .statusCode(200)
            .contentType(startsWith("text/csv"))
            .header("Content-Disposition", containsString(".csv"))
            .body(containsString("Sarah,yoga,enjoys"));
    }

    @Test
    void testExportUnknownFormatIsRejected() {
        given()
            .queryParam("format", "xlsx")
        .when()
            .get("/api/v1/profiles/{profileId}/graph/export", profileId)
        .then()
            .statusCode(400);
    }

    @Test
    void testDeleteNodeRemovesIncidentEdges() {
        given()
        .when()
            .delete("/api/v1/profiles/{profileId}/graph/nodes/{nodeId}", profileId, yoga.getId())
        .then()
            .statusCode(204);

        given()
            .get("/api/v1/profiles/{profileId}/graph/edges", profileId)
            .then().statusCode(200).body("size()", equalTo(0));
        given()
            .delete("/api/v1/profiles/{profileId}/graph/nodes/{nodeId}", profileId, yoga.getId())
            .then().statusCode(404);
    }

    @Test
    void testClearProfile() {
        given()
        .when()
            .delete("/api/v1/profiles/{profileId}/graph", profileId)
        .then()
            .statusCode(204);

        given()
            .get("/api/v1/profiles/{profileId}/graph/nodes", profileId)
            .then().statusCode(200).body("size()", equalTo(0));
    }
}
