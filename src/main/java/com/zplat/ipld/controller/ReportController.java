package com.zplat.ipld.controller;

import com.zplat.ipld.common.LogApi;
import com.zplat.ipld.dto.ApiResponse;
import com.zplat.ipld.dto.response.IngestionResponse;
import com.zplat.ipld.service.ReportService;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class ReportController {
    ReportService reportService;

    @GetMapping("/{view}")
    public ApiResponse<List<?>> getReport(@PathVariable String view) {
        return ApiResponse.<List<?>>builder()
                .result(reportService.getReport(view))
                .build();
    }

    @LogApi
    @PostMapping("/ingest")
    public ApiResponse<IngestionResponse> ingest() {
        return ApiResponse.<IngestionResponse>builder()
                .result(IngestionResponse.builder().sysnames(reportService.ingest()).build())
                .build();
    }
}
