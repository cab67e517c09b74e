package com.deepfake.scan.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 服务健康状态
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HealthStatus {

    public static final String HEALTHY = "healthy";
    public static final String UNHEALTHY = "unhealthy";

    private String status;
    private String service;
    private String version;
    private String model;

    /**
     * loaded / not_loaded
     */
    private String modelStatus;

    /**
     * 当前人脸检测后端
     */
    private String detector;

    private String timestamp;

    @JsonIgnore
    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }
}
