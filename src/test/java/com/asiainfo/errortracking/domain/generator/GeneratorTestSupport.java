package com.asiainfo.errortracking.domain.generator;

import com.asiainfo.errortracking.common.config.BreakdownsConfig;
import org.mockito.Mockito;

/**
 * 在容器外组装计划构造器
 */
public final class GeneratorTestSupport {

    private GeneratorTestSupport() {
    }

    public static BreakdownPlanBuilder newPlanBuilder(int defaultLimit) {
        BreakdownsConfig config = Mockito.mock(BreakdownsConfig.class);
        Mockito.when(config.getDefaultLimit()).thenReturn(defaultLimit);

        BreakdownPlanBuilder builder = new BreakdownPlanBuilder();
        builder.config = config;
        return builder;
    }
}
