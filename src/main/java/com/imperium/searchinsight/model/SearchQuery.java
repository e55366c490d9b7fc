package com.imperium.searchinsight.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一次搜索请求。text 去首尾空白后不能为空。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SearchQuery {

    private String text;

    @Builder.Default
    private SearchType type = SearchType.GENERAL;

    @Builder.Default
    private SearchParams params = SearchParams.defaults();

    /** 调用方标识（原先是手机号），只用于日志，不参与缓存键 */
    @Builder.Default
    private String requesterId = "anonymous";
}
