package com.imperium.searchinsight.model.dto.request;

import com.imperium.searchinsight.model.SearchParams;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * POST /api/v1/search 请求体。
 */
@Data
public class SearchRequest {

    /** 必填，1~2000 字符 */
    @NotBlank(message = "query is required")
    @Size(max = 2000, message = "query length must be 1~2000")
    private String query;

    /** 调用方标识（可选） */
    private String requesterId;

    /** general | news | image（可选） */
    @Pattern(regexp = "^(general|news|image)?$", message = "searchType must be one of: general, news, image")
    private String searchType;

    /** 可选，未知字段会被拒绝 */
    private SearchParams params;
}
