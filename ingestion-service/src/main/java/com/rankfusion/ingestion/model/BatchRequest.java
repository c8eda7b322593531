package com.rankfusion.ingestion.model;

import lombok.Data;

@Data
public class BatchRequest {
    private String source = BatchSource.MEMORY_SHORT.label();
}
