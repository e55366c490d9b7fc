package com.imperium.searchinsight.content;

import org.jsoup.Jsoup;

import java.util.regex.Pattern;

/**
 * 清洗 provider 返回的片段：去掉 HTML 标记与站点样板词（登录、订阅、电子报、图片编号等），合并空白。
 */
public final class TextCleaner {

    private static final Pattern BOILERPLATE = Pattern.compile(
            "\\b(LOGIN|Subscribe|e-?Paper|Account)\\b|Image \\d+:", Pattern.CASE_INSENSITIVE);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public static String clean(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String plain = text.indexOf('<') >= 0 || text.indexOf('&') >= 0 ? Jsoup.parse(text).text() : text;
        plain = BOILERPLATE.matcher(plain).replaceAll(" ");
        return WHITESPACE.matcher(plain).replaceAll(" ").trim();
    }

    private TextCleaner() {}
}
