package com.lbg.feedreader.api;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static io.restassured.RestAssured.given;
import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasItem;

@QuarkusTest
class FeedResourceTest {

    @Test
    void shouldListDefaultFeedsFirst() {
        given()
                .when().get("/api/feeds")
                .then()
                .statusCode(200)
                .contentType(ContentType.JSON)
                .body("size()", greaterThanOrEqualTo(4))
                .body("[0].ID", is("b1031651-411c-40bb-b269-d247794dfd59"))
                .body("[0].Title", is("BBC News - UK"))
                .body("[2].Category", is("Sky News"));
    }

    @Test
    void shouldRegisterFeedAndFetchItById() {
        String url = "http://example.com/rss/" + UUID.randomUUID();

        String id = given()
                .contentType(ContentType.JSON)
                .body("{\"ID\": \"client-id\", \"Title\": \"Example\", \"Description\": \"An example\", "
                        + "\"URL\": \"" + url + "\", \"ImageURL\": \"\", \"Category\": \"Test\"}")
                .when().post("/api/feeds")
                .then()
                .statusCode(200)
                .body("ID", notNullValue())
                .body("ID", not(equalTo("client-id")))
                .extract().path("ID");

        given()
                .when().get("/api/feeds/" + id)
                .then()
                .statusCode(200)
                .body("ID", is(id))
                .body("Title", is("Example"))
                .body("URL", is(url))
                .body("Category", is("Test"));

        given()
                .when().get("/api/feeds")
                .then()
                .statusCode(200)
                .body("URL", hasItem(url));
    }

    @Test
    void shouldReturnSameIdWhenUrlIsRegisteredTwice() {
        String body = "{\"URL\": \"http://example.com/rss/" + UUID.randomUUID() + "\"}";

        String first = given().contentType(ContentType.JSON).body(body)
                .when().post("/api/feeds")
                .then().statusCode(200)
                .extract().path("ID");

        given().contentType(ContentType.JSON).body(body)
                .when().post("/api/feeds")
                .then()
                .statusCode(200)
                .body("ID", is(first));
    }

    @Test
    void shouldReturnDefaultIdForDefaultUrl() {
        given()
                .contentType(ContentType.JSON)
                .body("{\"URL\": \"http://feeds.skynews.com/feeds/rss/uk.xml\"}")
                .when().post("/api/feeds")
                .then()
                .statusCode(200)
                .body("ID", is("28059396-5113-46ed-b76b-6d482a3bbcf3"));
    }

    @Test
    void shouldReturnJsonNotFoundForUnknownFeed() {
        given()
                .when().get("/api/feeds/nonexistent")
                .then()
                .statusCode(404)
                .contentType(ContentType.JSON)
                .body("error", is("Feed does not exist: nonexistent"));
    }

    @Test
    void shouldReturnJsonNotFoundForUnknownEndpoint() {
        given()
                .when().get("/api/unknown")
                .then()
                .statusCode(404)
                .contentType(ContentType.JSON)
                .body("error", is("Endpoint not found"));
    }

    @Test
    void shouldRejectNonJsonBody() {
        given()
                .contentType(ContentType.TEXT)
                .body("http://example.com/rss")
                .when().post("/api/feeds")
                .then()
                .statusCode(415)
                .contentType(ContentType.JSON)
                .body("error", notNullValue());
    }

    @Test
    void shouldRejectFeedWithoutUrl() {
        given()
                .contentType(ContentType.JSON)
                .body("{\"Title\": \"No address\"}")
                .when().post("/api/feeds")
                .then()
                .statusCode(400)
                .body("error", is("Feed URL is required"));
    }

    @Test
    void shouldRejectMalformedJson() {
        given()
                .contentType(ContentType.JSON)
                .body("{\"URL\": ")
                .when().post("/api/feeds")
                .then()
                .statusCode(400);
    }
}
