package com.spreadsheet.calc.controllers;

import com.spreadsheet.calc.CalcApplication;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests using a running server instance (RANDOM_PORT).
 * These tests verify end-to-end HTTP behavior and JSON handling.
 */
@SpringBootTest(
        classes = CalcApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class SheetControllerIntegrationTest {

    @LocalServerPort
    int port;

    private final RestTemplate restTemplate = new RestTemplate();
    private HttpHeaders textHeaders;

    @BeforeEach
    void setUp() {
        textHeaders = new HttpHeaders();
        textHeaders.setContentType(MediaType.TEXT_PLAIN);
    }

    private String url(String path) {
        return "http://localhost:" + port + "/sheet" + path;
    }

    private long createSheet(String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        ResponseEntity<Long> createResponse =
                restTemplate.postForEntity(url(""), new HttpEntity<>(body, headers), Long.class);
        assertEquals(HttpStatus.OK, createResponse.getStatusCode());
        assertNotNull(createResponse.getBody());
        return createResponse.getBody();
    }

    private void put(long sheetId, String label, String rawValue) {
        restTemplate.put(url("/" + sheetId + "/cell/" + label), new HttpEntity<>(rawValue, textHeaders));
    }

    private Map<String, Object> getSheet(long sheetId) {
        ResponseEntity<Map> response = restTemplate.getForEntity(url("/" + sheetId), Map.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        return response.getBody();
    }

    /**
     * Tests creating a sheet, setting cells,
     * then trying malformed input that should fail with 400.
     */
    @Test
    void testCreateSheetAndSetFormula() {
        long sheetId = createSheet("{\"rows\": 5, \"cols\": 3}");

        put(sheetId, "A1", "10");
        put(sheetId, "B1", "=A1*3");

        HttpClientErrorException badInput = assertThrows(HttpClientErrorException.class,
                () -> put(sheetId, "C1", "hello"));
        assertEquals(HttpStatus.BAD_REQUEST, badInput.getStatusCode());
        assertTrue(badInput.getResponseBodyAsString().contains("PARSE_FAILURE"));

        HttpClientErrorException outside = assertThrows(HttpClientErrorException.class,
                () -> put(sheetId, "D1", "1"));
        assertEquals(HttpStatus.BAD_REQUEST, outside.getStatusCode());
        assertTrue(outside.getResponseBodyAsString().contains("INVALID_RANGE"));

        Map<String, Object> data = getSheet(sheetId);
        assertEquals(10, data.get("A1"));
        assertEquals(30, data.get("B1"));
        assertFalse(data.containsKey("C1"));
    }

    @Test
    void testCreateSheetWithDefaults() {
        long sheetId = createSheet("{}");
        // test profile: 10x10
        put(sheetId, "J10", "1");
        assertThrows(HttpClientErrorException.class, () -> put(sheetId, "K1", "1"));
    }

    @Test
    void testGetCellView() {
        long sheetId = createSheet("{\"rows\": 5, \"cols\": 5}");
        put(sheetId, "A1", "=7/B1");

        ResponseEntity<Map> response = restTemplate.getForEntity(url("/" + sheetId + "/cell/A1"), Map.class);
        Map<?, ?> view = response.getBody();
        assertNotNull(view);
        assertEquals("A1", view.get("label"));
        assertEquals("DIVIDE_BY_ZERO", view.get("error"));
        assertEquals("=7/B1", view.get("formula"));
        assertNull(view.get("value"));

        put(sheetId, "B1", "7");
        view = restTemplate.getForEntity(url("/" + sheetId + "/cell/A1"), Map.class).getBody();
        assertEquals(1, view.get("value"));
        assertEquals("NONE", view.get("error"));
    }

    @Test
    void testGetForwardDependencyGraph() {
        long sheetId = createSheet("{\"rows\": 5, \"cols\": 5}");

        // B1 -> C2, A1 -> B1
        put(sheetId, "B1", "=C2+1");
        put(sheetId, "A1", "=B1+1");

        ResponseEntity<Map> response = restTemplate.getForEntity(url("/" + sheetId + "/forwardDependencies"), Map.class);
        Map<String, List<String>> forwardGraph = response.getBody();
        assertNotNull(forwardGraph);

        assertEquals(Collections.singletonList("C2"), forwardGraph.get("B1"));
        assertEquals(Collections.singletonList("B1"), forwardGraph.get("A1"));
        assertTrue(forwardGraph.get("C2").isEmpty());
    }

    @Test
    void testGetReverseDependencyGraph() {
        long sheetId = createSheet("{\"rows\": 5, \"cols\": 5}");

        // B3 -> A3, C3 -> B3
        put(sheetId, "B3", "=A3+1");
        put(sheetId, "C3", "=B3+1");

        ResponseEntity<Map> response = restTemplate.getForEntity(url("/" + sheetId + "/reverseDependencies"), Map.class);
        Map<String, List<String>> reverseGraph = response.getBody();
        assertNotNull(reverseGraph);

        assertEquals(Collections.singletonList("B3"), reverseGraph.get("A3"));
        assertEquals(Collections.singletonList("C3"), reverseGraph.get("B3"));
        assertTrue(reverseGraph.get("C3").isEmpty());
    }

    /**
     * Verifies recomputation: C1 reads A1. Changing A1 re-updates C1.
     */
    @Test
    void testRecomputationIntegration() {
        long sheetId = createSheet("{\"rows\": 5, \"cols\": 5}");

        put(sheetId, "A1", "4");
        put(sheetId, "C1", "=A1-1");
        assertEquals(3, getSheet(sheetId).get("C1"));

        put(sheetId, "A1", "9");
        assertEquals(8, getSheet(sheetId).get("C1"));
    }

    /**
     * Tests a cycle: A1 -> B1 -> A1 => should fail and keep the old value.
     */
    @Test
    void testCycleIntegration() {
        long sheetId = createSheet("{\"rows\": 5, \"cols\": 5}");

        put(sheetId, "A1", "5");
        put(sheetId, "B1", "=A1+1");

        HttpClientErrorException ex = assertThrows(HttpClientErrorException.class,
                () -> put(sheetId, "A1", "=B1+1"));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        assertTrue(ex.getResponseBodyAsString().contains("CIRCULAR_REFERENCE"));

        assertEquals(5, getSheet(sheetId).get("A1"));
        assertEquals(6, getSheet(sheetId).get("B1"));
    }

    @Test
    void testUndoRedoAndConflicts() {
        long sheetId = createSheet("{\"rows\": 5, \"cols\": 5}");

        HttpClientErrorException noHistory = assertThrows(HttpClientErrorException.class,
                () -> restTemplate.postForEntity(url("/" + sheetId + "/undo"), null, Void.class));
        assertEquals(HttpStatus.CONFLICT, noHistory.getStatusCode());

        put(sheetId, "A1", "1");
        put(sheetId, "A1", "2");
        restTemplate.postForEntity(url("/" + sheetId + "/undo"), null, Void.class);
        assertEquals(1, getSheet(sheetId).get("A1"));
        restTemplate.postForEntity(url("/" + sheetId + "/redo"), null, Void.class);
        assertEquals(2, getSheet(sheetId).get("A1"));

        HttpClientErrorException emptyBuffer = assertThrows(HttpClientErrorException.class,
                () -> restTemplate.postForEntity(url("/" + sheetId + "/paste/B1"), null, Void.class));
        assertEquals(HttpStatus.CONFLICT, emptyBuffer.getStatusCode());
    }

    @Test
    void testRangeCommands() {
        long sheetId = createSheet("{\"rows\": 6, \"cols\": 3}");
        put(sheetId, "A1", "5");
        put(sheetId, "A2", "1");
        put(sheetId, "A3", "3");

        restTemplate.postForEntity(url("/" + sheetId + "/sort/A1:A3?direction=asc"), null, Void.class);
        Map<String, Object> data = getSheet(sheetId);
        assertEquals(1, data.get("A1"));
        assertEquals(3, data.get("A2"));
        assertEquals(5, data.get("A3"));

        restTemplate.postForEntity(url("/" + sheetId + "/autofill/A1:A3/A6"), null, Void.class);
        data = getSheet(sheetId);
        assertEquals(7, data.get("A4"));
        assertEquals(11, data.get("A6"));

        restTemplate.postForEntity(url("/" + sheetId + "/cut/A1:A2"), null, Void.class);
        restTemplate.postForEntity(url("/" + sheetId + "/paste/B1"), null, Void.class);
        data = getSheet(sheetId);
        // a cut cell is blank again
        assertFalse(data.containsKey("A1"));
        assertEquals(1, data.get("B1"));
        assertEquals(3, data.get("B2"));

        HttpClientErrorException badRange = assertThrows(HttpClientErrorException.class,
                () -> restTemplate.postForEntity(url("/" + sheetId + "/copy/B2:A1"), null, Void.class));
        assertEquals(HttpStatus.BAD_REQUEST, badRange.getStatusCode());
    }

    @Test
    void testExportAndImport() {
        long sheetId = createSheet("{\"rows\": 2, \"cols\": 2}");
        put(sheetId, "A1", "3");
        put(sheetId, "B2", "=A1*A1");

        String csv = restTemplate.getForObject(url("/" + sheetId + "/export"), String.class);
        assertEquals("3,0\n0,9\n", csv);

        HttpHeaders csvHeaders = new HttpHeaders();
        csvHeaders.setContentType(MediaType.valueOf("text/csv"));
        Long imported = restTemplate.postForObject(url("/import"), new HttpEntity<>(csv, csvHeaders), Long.class);
        assertNotNull(imported);

        Map<String, Object> data = getSheet(imported);
        assertEquals(3, data.get("A1"));
        assertEquals(9, data.get("B2"));
    }

    @Test
    void testUnknownSheet() {
        HttpClientErrorException ex = assertThrows(HttpClientErrorException.class,
                () -> restTemplate.getForEntity(url("/987654"), Map.class));
        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
    }
}
