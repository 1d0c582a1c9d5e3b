package com.example.pdfstamp.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ContractGenerationRequestTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    public void testTemplateNamesList() throws Exception {
        ContractGenerationRequest request = mapper.readValue(
                "{\"template_names\": [\"a\", \"b\"], \"context\": {\"x\": 1}}", ContractGenerationRequest.class);

        assertEquals(List.of("a", "b"), request.templateNameList());
        assertEquals(1, request.getContext().get("x"));
    }

    @Test
    public void testTemplateNamesMustBeStrings() throws Exception {
        assertNull(mapper.readValue("{\"template_names\": \"a\"}", ContractGenerationRequest.class).templateNameList());
        assertNull(mapper.readValue("{\"template_names\": [1]}", ContractGenerationRequest.class).templateNameList());
        assertNull(mapper.readValue("{}", ContractGenerationRequest.class).templateNameList());
    }
}
