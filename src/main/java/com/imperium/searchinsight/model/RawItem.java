package com.imperium.searchinsight.model;

/**
 * 与 provider 无关的单条搜索结果。
 */
public record RawItem(String title, String url, String snippet) {

    public RawItem {
        title = title != null ? title : "";
        url = url != null ? url : "";
        snippet = snippet != null ? snippet : "";
    }

    public RawItem withSnippet(String newSnippet) {
        return new RawItem(title, url, newSnippet);
    }
}
