package com.iimsoft.bom.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * BOM 展开与对账的参数。
 *
 * 配置来源（优先级从高到低）：
 * 1) 请求里的覆盖项（见 ExplodeRequest.config）
 * 2) JVM 参数：-Dbom.explosion=JSON
 * 3) 默认值
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExplosionConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExplosionConfig.class);

    /** JVM 参数 key */
    public static final String EXPLOSION_CONFIG_JSON_PROPERTY = "bom.explosion";

    public static final int DEFAULT_MAX_DEPTH = 64;
    public static final int DEFAULT_MAX_DISTINCT_PATHS = 1_000_000;
    public static final double DEFAULT_QUANTITY_TOLERANCE = 0.01;

    /** 虚拟件最大嵌套层数 */
    @JsonProperty("maxDepth")
    private int maxDepth = DEFAULT_MAX_DEPTH;

    /** 单次展开允许的不同路径数上限 */
    @JsonProperty("maxDistinctPaths")
    private int maxDistinctPaths = DEFAULT_MAX_DISTINCT_PATHS;

    @JsonProperty("rootPolicy")
    private RootPolicy rootPolicy = RootPolicy.STRICT;

    /** 对账时数量差超过该值视为不一致 */
    @JsonProperty("quantityTolerance")
    private double quantityTolerance = DEFAULT_QUANTITY_TOLERANCE;

    public ExplosionConfig() {
    }

    public static ExplosionConfig defaults() {
        return new ExplosionConfig();
    }

    /**
     * 读取 JVM 参数；未设置时返回默认值，JSON 无效时回退默认并记录 WARN。
     */
    public static ExplosionConfig load() {
        String json = System.getProperty(EXPLOSION_CONFIG_JSON_PROPERTY);
        if (json == null || json.isBlank()) {
            return defaults();
        }
        try {
            return new ObjectMapper().readValue(json, ExplosionConfig.class).validated();
        } catch (Exception e) {
            LOGGER.warn("Invalid -D{} value, falling back to defaults: {}", EXPLOSION_CONFIG_JSON_PROPERTY, e.getMessage());
            return defaults();
        }
    }

    /**
     * 校验取值范围，非法时抛 IllegalArgumentException。
     */
    public ExplosionConfig validated() {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        if (maxDistinctPaths <= 0) {
            throw new IllegalArgumentException("maxDistinctPaths must be positive: " + maxDistinctPaths);
        }
        if (quantityTolerance < 0) {
            throw new IllegalArgumentException("quantityTolerance must not be negative: " + quantityTolerance);
        }
        if (rootPolicy == null) {
            rootPolicy = RootPolicy.STRICT;
        }
        return this;
    }

    public int getMaxDepth() { return maxDepth; }
    public int getMaxDistinctPaths() { return maxDistinctPaths; }
    public RootPolicy getRootPolicy() { return rootPolicy; }
    public double getQuantityTolerance() { return quantityTolerance; }

    public ExplosionConfig withMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
        return this;
    }

    public ExplosionConfig withMaxDistinctPaths(int maxDistinctPaths) {
        this.maxDistinctPaths = maxDistinctPaths;
        return this;
    }

    public ExplosionConfig withRootPolicy(RootPolicy rootPolicy) {
        this.rootPolicy = rootPolicy;
        return this;
    }

    public ExplosionConfig withQuantityTolerance(double quantityTolerance) {
        this.quantityTolerance = quantityTolerance;
        return this;
    }

    public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }
    public void setMaxDistinctPaths(int maxDistinctPaths) { this.maxDistinctPaths = maxDistinctPaths; }
    public void setRootPolicy(RootPolicy rootPolicy) { this.rootPolicy = rootPolicy; }
    public void setQuantityTolerance(double quantityTolerance) { this.quantityTolerance = quantityTolerance; }

    @Override
    public String toString() {
        return "ExplosionConfig{maxDepth=" + maxDepth + ", maxDistinctPaths=" + maxDistinctPaths
                + ", rootPolicy=" + rootPolicy + ", quantityTolerance=" + quantityTolerance + "}";
    }
}
