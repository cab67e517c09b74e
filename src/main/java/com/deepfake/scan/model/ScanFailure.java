package com.deepfake.scan.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 扫描失败记录，status 与HTTP状态码语义一致（400/503/500）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanFailure implements Serializable {

    private static final long serialVersionUID = 1L;

    private String hash;

    private Integer status;

    private String error;

    private String message;

    private Long timestamp;
}
