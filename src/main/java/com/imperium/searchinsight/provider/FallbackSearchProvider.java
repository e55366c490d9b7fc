package com.imperium.searchinsight.provider;

import com.imperium.searchinsight.model.RawSearchResult;

/**
 * 备用搜索源，仅在首选源失败时调用。只接收查询文本。
 */
public interface FallbackSearchProvider {

    String id();

    RawSearchResult query(String text);
}
