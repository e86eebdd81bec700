package com.pixeltrack.ingest.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchIngestionResponse {

    private boolean ok;
    private int ingested;
}
