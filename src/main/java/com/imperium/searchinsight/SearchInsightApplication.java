package com.imperium.searchinsight;

import com.imperium.searchinsight.config.DotenvLoader;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SearchInsightApplication {

    public static void main(String[] args) {
        DotenvLoader.load(); // 加载 .env 到系统属性，供 application.yaml 中的 ${TAVILY_API_KEY} 使用
        SpringApplication.run(SearchInsightApplication.class, args);
    }
}
