package com.iimsoft.bom.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.iimsoft.bom.api.dto.ExplodeRequest;
import com.iimsoft.bom.api.dto.ExplodeResponse;
import com.iimsoft.bom.exception.ExplosionLimitExceededException;
import com.iimsoft.bom.exception.MalformedQuantityException;
import java.io.IOException;
import java.io.InputStream;
import org.junit.jupiter.api.Test;

final class BestellijstApiServiceTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final BestellijstApiService service = new BestellijstApiService();

    @Test
    void explodesJsonRequest() throws IOException {
        ExplodeRequest request;
        try (InputStream in = getClass().getResourceAsStream("/explode-request.json")) {
            request = mapper.readValue(in, ExplodeRequest.class);
        }

        ExplodeResponse response = service.explode(request);

        assertEquals("FRAME", response.rootItem);
        assertEquals(2, response.bestellijst.size());
        assertEquals("BOLT", response.bestellijst.get(0).getItem());
        assertEquals(8d, response.bestellijst.get(0).getTotalQuantity(), 1e-9);
        assertEquals("PLATE", response.bestellijst.get(1).getItem());
        assertEquals(2.5, response.bestellijst.get(1).getTotalQuantity(), 1e-9);
        assertEquals(1, response.lengthItems.size());
        assertEquals(1200d, response.lengthItems.get(0).getTotalQuantity(), 1e-9);
        assertEquals("FRAME (×2.0) → SIDE (×4.0) → BOLT", response.traces.get("BOLT").get(0).path);
        assertEquals(3, response.comparison.size());

        JsonNode json = mapper.readTree(mapper.writeValueAsString(response));
        assertEquals("QUANTITY_DIFFERS", json.get("comparison").get(0).get("status").asText());
    }

    @Test
    void omitsTraceAndComparisonWhenNotRequested() throws IOException {
        String json = "{\"includeTrace\":false,\"rows\":["
                + "{\"item\":\"R\",\"level\":0,\"makeOrBuy\":\"Production\"},"
                + "{\"parentItem\":\"R\",\"item\":\"X\",\"quantityPerParent\":3,\"makeOrBuy\":\"Purchased\",\"level\":1}]}";

        ExplodeResponse response = service.explode(mapper.readValue(json, ExplodeRequest.class));

        assertNull(response.traces);
        assertNull(response.comparison);
        assertEquals(3d, response.bestellijst.get(0).getTotalQuantity(), 1e-9);
        String out = mapper.writeValueAsString(response);
        assertFalse(mapper.readTree(out).has("traces"));
    }

    @Test
    void reportsMalformedQuantityByRowIndex() throws IOException {
        String json = "{\"rows\":["
                + "{\"item\":\"R\",\"level\":0},"
                + "{\"parentItem\":\"R\",\"item\":\"X\",\"quantityPerParent\":\"drie\",\"makeOrBuy\":\"Purchased\",\"level\":1}]}";

        MalformedQuantityException e = assertThrows(MalformedQuantityException.class,
                () -> service.explode(mapper.readValue(json, ExplodeRequest.class)));
        assertEquals(2, e.getLineNumber());
    }

    @Test
    void requestConfigOverridesDefaults() throws IOException {
        String json = "{\"config\":{\"maxDepth\":3},\"rows\":["
                + "{\"item\":\"R\",\"level\":0},"
                + "{\"parentItem\":\"R\",\"item\":\"A\",\"quantityPerParent\":1,\"makeOrBuy\":\"Production\",\"lineType\":\"Phantom\"},"
                + "{\"parentItem\":\"A\",\"item\":\"R\",\"quantityPerParent\":1,\"makeOrBuy\":\"Production\",\"lineType\":\"Phantom\"}]}";

        assertThrows(ExplosionLimitExceededException.class,
                () -> service.explode(mapper.readValue(json, ExplodeRequest.class)));
    }

    @Test
    void rejectsEmptyRequest() {
        assertThrows(IllegalArgumentException.class, () -> service.explode(new ExplodeRequest()));
    }
}
