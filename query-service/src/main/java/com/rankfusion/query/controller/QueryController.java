package com.rankfusion.query.controller;

import com.rankfusion.query.contract.RetrieveRequest;
import com.rankfusion.query.model.QueryRequest;
import com.rankfusion.query.model.QueryResult;
import com.rankfusion.query.service.QueryService;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@CrossOrigin(origins = "*")
public class QueryController {

    private final QueryService queryService;

    public QueryController(QueryService queryService) {
        this.queryService = queryService;
    }

    @PostMapping("/search")
    public QueryResult search(
            @RequestBody QueryRequest request,
            @RequestHeader(value = "X-Trace-Id", required = false) String traceId
    ) {
        return queryService.query(request, effectiveTraceId(traceId));
    }

    /**
     * Returns the bare result list, or the {@code rag.retrieve.v1} envelope when
     * {@code envelope=true}.
     */
    @PostMapping("/retrieve")
    public Object retrieve(
            @RequestBody RetrieveRequest request,
            @RequestParam(value = "envelope", defaultValue = "false") boolean envelope,
            @RequestHeader(value = "X-Trace-Id", required = false) String traceId
    ) {
        String effectiveTraceId = effectiveTraceId(traceId);
        if (envelope) {
            return queryService.retrieveEnvelope(request, effectiveTraceId);
        }
        return queryService.retrieve(request, effectiveTraceId);
    }

    private static String effectiveTraceId(String traceId) {
        return (traceId == null || traceId.isBlank()) ? UUID.randomUUID().toString() : traceId;
    }
}
