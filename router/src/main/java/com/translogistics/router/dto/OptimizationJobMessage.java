package com.translogistics.router.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OptimizationJobMessage {
    private String jobId;
    private OptimizationRequest request;
}
