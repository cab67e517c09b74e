package com.deepfake.scan.service;

import com.deepfake.scan.config.ScanJobConfig;

import java.io.Serializable;

/**
 * 在算子实例上创建推理服务（随Flink函数序列化分发）
 */
@FunctionalInterface
public interface ScanServiceFactory extends Serializable {

    ScanInferenceService create(ScanJobConfig config);
}
