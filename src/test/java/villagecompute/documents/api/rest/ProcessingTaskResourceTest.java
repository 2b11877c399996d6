/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.documents.api.rest;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.hasItem;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * End-to-end tests for {@link ProcessingTaskResource}: submit, poll, cancel, batch and analytics.
 */
@QuarkusTest
public class ProcessingTaskResourceTest {

    @Test
    public void testSubmitAndPollUntilCompleted() {
        String documentId = DocumentResourceTest.upload("brief.txt", "txt", "the brief is short and clear");

        String taskId = given().contentType(ContentType.JSON)
                .body(Map.of("documentId", documentId, "type", "text_extraction", "priority", 8)).when()
                .post("/api/tasks").then().statusCode(201).body("id", startsWith("task_"))
                .body("priority", equalTo(8)).extract().path("id");

        awaitStatus(taskId, "completed");

        given().when().get("/api/tasks/" + taskId).then().statusCode(200).body("status", equalTo("completed"))
                .body("result.text", equalTo("the brief is short and clear"))
                .body("result.extractionMethod", equalTo("Plain Text")).body("processingTime", notNullValue());
        given().queryParam("documentId", documentId).when().get("/api/tasks/results").then().statusCode(200)
                .body("taskId", hasItem(taskId));
        given().when().get("/api/documents/" + documentId).then()
                .body("processedAt", notNullValue());
    }

    @Test
    public void testUnknownDocumentReturnsNotFound() {
        given().contentType(ContentType.JSON).body(Map.of("documentId", "doc_nope", "type", "summarization")).when()
                .post("/api/tasks").then().statusCode(404).body("error", equalTo("Document doc_nope not found"));
    }

    @Test
    public void testOutOfRangePriorityIsRejected() {
        String documentId = DocumentResourceTest.upload("x.txt", "txt", "x");

        given().contentType(ContentType.JSON)
                .body(Map.of("documentId", documentId, "type", "text_extraction", "priority", 11)).when()
                .post("/api/tasks").then().statusCode(400);
    }

    @Test
    public void testUnsupportedTypeFailsAtExecution() {
        String documentId = DocumentResourceTest.upload("y.txt", "txt", "the text");

        String taskId = given().contentType(ContentType.JSON)
                .body(Map.of("documentId", documentId, "type", "quality_assessment")).when().post("/api/tasks")
                .then().statusCode(201).extract().path("id");

        awaitStatus(taskId, "failed");
        given().when().get("/api/tasks/" + taskId).then().body("error",
                equalTo("Unsupported task type: quality_assessment"));
    }

    @Test
    public void testCancelFinishedTaskConflicts() {
        String documentId = DocumentResourceTest.upload("z.txt", "txt", "the text");
        String taskId = given().contentType(ContentType.JSON)
                .body(Map.of("documentId", documentId, "type", "text_extraction")).when().post("/api/tasks").then()
                .statusCode(201).extract().path("id");
        awaitStatus(taskId, "completed");

        given().when().delete("/api/tasks/" + taskId).then().statusCode(409).body("cancelled", equalTo(false));
        given().when().delete("/api/tasks/task_unknown").then().statusCode(404).body("error",
                equalTo("Task task_unknown not found"));
        given().when().get("/api/tasks/task_unknown").then().statusCode(404).body("error",
                equalTo("Task task_unknown not found"));
    }

    @Test
    public void testBatchSkipsUnknownDocuments() {
        String documentId = DocumentResourceTest.upload("batch.txt", "txt", "the batch text");

        given().contentType(ContentType.JSON)
                .body(Map.of("documentIds", List.of(documentId, "doc_missing"), "taskTypes",
                        List.of("text_extraction", "classification")))
                .when().post("/api/tasks/batch").then().statusCode(200).body("submittedTasks", equalTo(2))
                .body("skippedDocuments", hasItem("doc_missing")).body("tasks.'" + documentId + "'.size()", equalTo(2));
    }

    @Test
    public void testBatchWithNullTypeCreatesNoTasks() {
        String documentId = DocumentResourceTest.upload("partial.txt", "txt", "the partial batch");

        given().contentType(ContentType.JSON)
                .body(Map.of("documentIds", List.of(documentId), "taskTypes",
                        Arrays.asList("text_extraction", null)))
                .when().post("/api/tasks/batch").then().statusCode(400);
        given().queryParam("documentId", documentId).when().get("/api/tasks").then().statusCode(200)
                .body("size()", equalTo(0));
    }

    @Test
    public void testEmptyBatchIsRejected() {
        given().contentType(ContentType.JSON)
                .body(Map.of("documentIds", List.of(), "taskTypes", List.of("text_extraction"))).when()
                .post("/api/tasks/batch").then().statusCode(400);
    }

    @Test
    public void testReadOnlyViews() {
        given().when().get("/api/tasks/analytics").then().statusCode(200).body("totalTasks", notNullValue())
                .body("successRate", notNullValue());
        given().when().get("/api/tasks/queue-status").then().statusCode(200).body("maxConcurrentTasks", equalTo(2));
        given().when().get("/api/tasks/capabilities").then().statusCode(200).body("taskTypes.size()", equalTo(13))
                .body("supportedFormats", hasItem("pdf")).body("batchLimit", equalTo(100));
        given().when().get("/api/tasks/results").then().statusCode(400);
    }

    private static void awaitStatus(String taskId, String expected) {
        long deadline = System.currentTimeMillis() + 5_000;
        while (System.currentTimeMillis() < deadline) {
            String status = given().when().get("/api/tasks/" + taskId).then().statusCode(200).extract()
                    .path("status");
            if (expected.equals(status)) {
                return;
            }
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted waiting for task " + taskId);
            }
        }
        fail("Task " + taskId + " did not reach " + expected);
    }
}
