package com.asiainfo.errortracking.common.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.ConfigProvider;

import static com.asiainfo.errortracking.domain.model.BreakdownConstants.DEFAULT_LIMIT;

/**
 * 拆分查询配置
 */
@ApplicationScoped
public class BreakdownsConfig {

    /**
     * 请求未指定 limit 时每个维度保留的取值个数
     */
    public int getDefaultLimit() {
        return ConfigProvider.getConfig()
                .getOptionalValue("breakdowns.default.limit", Integer.class)
                .orElse(DEFAULT_LIMIT);
    }

    /**
     * 单次查询返回的最大行数，默认 10000
     */
    public int getMaxRows() {
        return ConfigProvider.getConfig()
                .getOptionalValue("breakdowns.query.max-rows", Integer.class)
                .orElse(10000);
    }
}
