package com.imperium.searchinsight.model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchMetadata {

    /** 支撑结果条数 */
    private int resultCount;

    /** 本次调用耗时（毫秒） */
    private long queryTimeMs;

    private String searchType;

    /** 缓存键摘要（SHA-256） */
    private String cacheKey;
}
