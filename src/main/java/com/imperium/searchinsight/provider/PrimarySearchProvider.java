package com.imperium.searchinsight.provider;

import com.imperium.searchinsight.model.RawSearchResult;
import com.imperium.searchinsight.model.SearchParams;
import com.imperium.searchinsight.model.SearchType;

/**
 * 首选搜索源。实现是阻塞调用，由 {@link ProviderGateway} 负责放到工作线程池执行。
 */
public interface PrimarySearchProvider {

    String id();

    /**
     * @throws com.imperium.searchinsight.exception.ProviderException 超时、鉴权/配额、传输错误、响应无法解析
     */
    RawSearchResult query(String text, SearchType type, SearchParams params);
}
