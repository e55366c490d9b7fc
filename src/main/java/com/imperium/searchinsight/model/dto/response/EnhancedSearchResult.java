package com.imperium.searchinsight.model.dto.response;

import com.imperium.searchinsight.model.RawItem;
import com.imperium.searchinsight.model.SearchInsight;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * enhanced_search 返回结构：insight 本身加上常用字段的平铺投影。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnhancedSearchResult {

    private SearchInsight insight;

    private String summary;

    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    @Builder.Default
    private List<RawItem> rawResults = new ArrayList<>();

    private SearchMetadata metadata;
}
