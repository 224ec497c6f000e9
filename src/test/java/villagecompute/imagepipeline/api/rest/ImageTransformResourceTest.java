/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.api.rest;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.notNullValue;

import io.quarkus.test.junit.QuarkusTest;
import io.quarkus.test.security.TestSecurity;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.Test;
import villagecompute.imagepipeline.testing.TestImages;

/**
 * Integration tests for the image, job and cache admin endpoints.
 *
 * <p>
 * Storage is served by {@link InMemoryBlobStoreBean}; everything else runs with the real beans.
 */
@QuarkusTest
public class ImageTransformResourceTest {

    private String uploadImage(int width, int height) {
        return given().contentType("application/octet-stream").body(TestImages.jpeg(width, height)).when()
                .post("/api/images").then().statusCode(201).body("image_id", notNullValue())
                .body("width", equalTo(width)).body("height", equalTo(height)).body("mime_type", equalTo("image/jpeg"))
                .extract().path("image_id");
    }

    @Test
    @TestSecurity(
            user = "alice")
    public void testUploadAndResolveOriginal() {
        String imageId = uploadImage(320, 200);

        given().when().get("/api/images/{id}", imageId).then().statusCode(200).body("status", equalTo("original"))
                .body("image.owner_id", equalTo("alice")).body("original_url", notNullValue());
    }

    @Test
    @TestSecurity(
            user = "alice")
    public void testSubmitTransformAndWaitForJob() {
        String imageId = uploadImage(400, 300);

        String jobId = given().contentType(ContentType.JSON)
                .body("{\"operations\":[{\"op\":\"resize\",\"width\":100},{\"op\":\"grayscale\"}],\"format\":\"png\"}")
                .when().post("/api/images/{id}/transforms", imageId).then().statusCode(202)
                .body("status", equalTo("pending")).body("fingerprint", notNullValue()).extract().path("job_id");

        given().queryParam("timeoutMs", 10000).when().get("/api/jobs/{id}/wait", jobId).then().statusCode(200)
                .body("state", equalTo("succeeded")).body("artifact.width", equalTo(100))
                .body("artifact.height", equalTo(75));

        given().contentType(ContentType.JSON)
                .body("{\"operations\":[{\"op\":\"resize\",\"width\":100},{\"op\":\"grayscale\"}],\"format\":\"png\"}")
                .when().post("/api/images/{id}/transforms", imageId).then().statusCode(200)
                .body("status", equalTo("ready"));
    }

    @Test
    @TestSecurity(
            user = "alice")
    public void testInvalidSpecIsRejected() {
        String imageId = uploadImage(200, 200);

        given().contentType(ContentType.JSON).body("{\"operations\":[{\"op\":\"compress\",\"quality\":150}]}").when()
                .post("/api/images/{id}/transforms", imageId).then().statusCode(400);

        given().contentType(ContentType.JSON)
                .body("{\"operations\":[{\"op\":\"crop\",\"x\":0,\"y\":0,\"width\":2000,\"height\":10}]}").when()
                .post("/api/images/{id}/transforms", imageId).then().statusCode(400);
    }

    @Test
    @TestSecurity(
            user = "alice")
    public void testUnknownImageReturns404() {
        given().when().get("/api/images/{id}", "does-not-exist").then().statusCode(404);
    }

    @Test
    @TestSecurity(
            user = "alice")
    public void testWaitTimeoutOutOfRangeIsRejected() {
        given().queryParam("timeoutMs", 50000).when().get("/api/jobs/{id}/wait", "any").then().statusCode(400);
    }

    @Test
    @TestSecurity(
            user = "alice")
    public void testDeleteImage() {
        String imageId = uploadImage(64, 64);

        given().when().delete("/api/images/{id}", imageId).then().statusCode(204);
        given().when().get("/api/images/{id}", imageId).then().statusCode(404);
    }

    @Test
    public void testUploadRequiresAuthentication() {
        given().contentType("application/octet-stream").body(TestImages.jpeg(32, 32)).when().post("/api/images")
                .then().statusCode(401);
    }

    @Test
    @TestSecurity(
            user = "alice")
    public void testCacheStatsRequiresAdminRole() {
        given().when().get("/api/admin/cache/stats").then().statusCode(403);
    }

    @Test
    @TestSecurity(
            user = "ops",
            roles = "admin")
    public void testCacheStatsForAdmin() {
        given().when().get("/api/admin/cache/stats").then().statusCode(200).body("enabled", equalTo(true));
    }
}
