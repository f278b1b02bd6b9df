package de.bsommerfeld.unitupdate.gateway;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QueryStringEncoderTest {

    @Test
    void encode_shouldKeepInsertionOrder() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("name", "Acme.Blog");
        params.put("protocol_version", "1.3");
        params.put("client", "October CMS");

        assertEquals("name=Acme.Blog&protocol_version=1.3&client=October+CMS", QueryStringEncoder.encode(params));
    }

    @Test
    void encode_shouldIndexListsWithBrackets() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("names", List.of("Acme.Blog", "Acme.Shop"));

        assertEquals("names%5B0%5D=Acme.Blog&names%5B1%5D=Acme.Shop", QueryStringEncoder.encode(params));
    }

    @Test
    void encode_shouldNestMaps() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("filter", Map.of("type", "plugin"));

        assertEquals("filter%5Btype%5D=plugin", QueryStringEncoder.encode(params));
    }

    @Test
    void encode_shouldSkipNullsAndWriteBooleansAsDigits() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("build", null);
        params.put("force", false);
        params.put("edge", true);

        assertEquals("force=0&edge=1", QueryStringEncoder.encode(params));
    }

    @Test
    void encode_shouldPercentEncodeReservedCharacters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("server", "a+b/c=*");

        assertEquals("server=a%2Bb%2Fc%3D%2A", QueryStringEncoder.encode(params));
    }

    @Test
    void encode_shouldReturnEmptyStringForNoParams() {
        assertEquals("", QueryStringEncoder.encode(Map.of()));
    }
}
