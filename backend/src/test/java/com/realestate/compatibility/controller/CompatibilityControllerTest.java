package com.realestate.compatibility.controller;

import com.realestate.compatibility.dto.CompatibilityAuditRequest;
import com.realestate.compatibility.dto.CompatibilityAuditResponse;
import com.realestate.compatibility.engine.LandUseBreakdownRow;
import com.realestate.compatibility.engine.ScoreSummaryRow;
import com.realestate.compatibility.exception.CompatibilityAnalysisException;
import com.realestate.compatibility.exception.InvalidInputException;
import com.realestate.compatibility.exception.ParcelSourceException;
import com.realestate.compatibility.service.CompatibilityAuditService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(CompatibilityController.class)
class CompatibilityControllerTest {

    private static final String REQUEST_BODY = "{"
            + "\"parcels\":{\"type\":\"FeatureCollection\",\"features\":[]},"
            + "\"matrix\":{\"Residential\":{\"Industrial\":1}},"
            + "\"adjacencyDistance\":10,"
            + "\"landUseField\":\"KARBARI_MO\"}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CompatibilityAuditService auditService;

    private static CompatibilityAuditResponse sampleResponse() {
        Map<Integer, Long> residential = new LinkedHashMap<>();
        residential.put(1, 1L);
        residential.put(2, 0L);
        residential.put(3, 0L);
        residential.put(4, 0L);
        residential.put(5, 0L);

        Map<String, Object> scored = new LinkedHashMap<>();
        scored.put("type", "FeatureCollection");
        scored.put("features", List.of());

        return CompatibilityAuditResponse.builder()
                .scoredParcels(scored)
                .overallSummary(List.of(
                        new ScoreSummaryRow(1, 1, 100.0),
                        new ScoreSummaryRow(2, 0, 0.0),
                        new ScoreSummaryRow(3, 0, 0.0),
                        new ScoreSummaryRow(4, 0, 0.0),
                        new ScoreSummaryRow(5, 0, 0.0)))
                .detailedBreakdown(List.of(new LandUseBreakdownRow("Residential", residential, 1)))
                .parcelCount(1)
                .adjacentPairCount(1)
                .adjacencyDistance(10.0)
                .landUseField("KARBARI_MO")
                .coordinateSpace("PROJECTED")
                .warnings(List.of())
                .elapsedMillis(12)
                .build();
    }

    @Test
    void auditReturnsScoredParcelsAndSummaries() throws Exception {
        when(auditService.audit(any(CompatibilityAuditRequest.class))).thenReturn(sampleResponse());

        mockMvc.perform(post("/api/compatibility/audit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(REQUEST_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.scoredParcels.type").value("FeatureCollection"))
                .andExpect(jsonPath("$.overallSummary.length()").value(5))
                .andExpect(jsonPath("$.overallSummary[0].compatibilityScore").value(1))
                .andExpect(jsonPath("$.overallSummary[0].percentage").value(100.0))
                .andExpect(jsonPath("$.detailedBreakdown[0].landUseClass").value("Residential"))
                .andExpect(jsonPath("$.coordinateSpace").value("PROJECTED"));
    }

    @Test
    void overallReportIsCsvAttachment() throws Exception {
        when(auditService.audit(any(CompatibilityAuditRequest.class))).thenReturn(sampleResponse());
        String body = REQUEST_BODY.replace("\"landUseField\"", "\"baseName\":\"qazvin 2024\",\"landUseField\"");

        mockMvc.perform(post("/api/compatibility/audit/reports/overall")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION,
                        containsString("qazvin_2024_overall_summary.csv")))
                .andExpect(content().string(containsString("compatibility_score,parcel_count,percentage")))
                .andExpect(content().string(containsString("1,1,100.0")));
    }

    @Test
    void detailedReportUsesLandUseFieldHeader() throws Exception {
        when(auditService.audit(any(CompatibilityAuditRequest.class))).thenReturn(sampleResponse());

        mockMvc.perform(post("/api/compatibility/audit/reports/detailed")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(REQUEST_BODY))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION,
                        containsString("compatibility_detailed_breakdown.csv")))
                .andExpect(content().string(containsString("KARBARI_MO,1,2,3,4,5,total_parcels")))
                .andExpect(content().string(containsString("Residential,1,0,0,0,0,1")));
    }

    @Test
    void storedAuditPassesQueryParameters() throws Exception {
        when(auditService.auditStored(eq(25.0), eq("zoning"), isNull())).thenReturn(sampleResponse());

        mockMvc.perform(get("/api/compatibility/audit/stored")
                        .param("adjacencyDistance", "25")
                        .param("landUseField", "zoning"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.parcelCount").value(1));

        verify(auditService).auditStored(25.0, "zoning", null);
    }

    @Test
    void invalidInputIsBadRequest() throws Exception {
        when(auditService.audit(any(CompatibilityAuditRequest.class)))
                .thenThrow(new InvalidInputException("Land use field 'KARBARI_MO' not found on feature 0"));

        mockMvc.perform(post("/api/compatibility/audit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(REQUEST_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid Input"))
                .andExpect(jsonPath("$.message").value(containsString("KARBARI_MO")));
    }

    @Test
    void analysisFailureIsUnprocessable() throws Exception {
        when(auditService.audit(any(CompatibilityAuditRequest.class)))
                .thenThrow(new CompatibilityAnalysisException("Compatibility analysis failed: side location conflict",
                        new IllegalStateException()));

        mockMvc.perform(post("/api/compatibility/audit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(REQUEST_BODY))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("Analysis Failed"));
    }

    @Test
    void unavailableParcelLayerIsServiceUnavailable() throws Exception {
        when(auditService.auditStored(any(), any(), any()))
                .thenThrow(new ParcelSourceException("Unable to connect to the parcel database"));

        mockMvc.perform(get("/api/compatibility/audit/stored"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void missingParcelsFailsValidation() throws Exception {
        mockMvc.perform(post("/api/compatibility/audit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"adjacencyDistance\":-5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Error"))
                .andExpect(jsonPath("$.fieldErrors.parcels").exists())
                .andExpect(jsonPath("$.fieldErrors.adjacencyDistance").exists());

        verifyNoInteractions(auditService);
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/compatibility/audit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"parcels\": [unterminated"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed Request"));
    }
}
