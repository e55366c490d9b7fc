package com.imperium.searchinsight.provider;

import com.imperium.searchinsight.model.InsightSource;
import com.imperium.searchinsight.model.RawSearchResult;

/**
 * 网关输出：归一化结果 + 实际应答的 provider。
 */
public record ProviderResponse(RawSearchResult result, InsightSource source) {
}
