package cn.bafuka.tiercache.example;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * TierCache 示例应用启动类
 */
@SpringBootApplication
public class TierCacheExampleApplication {

    public static void main(String[] args) {
        SpringApplication.run(TierCacheExampleApplication.class, args);
        System.out.println("\n========================================");
        System.out.println("  TierCache Example Application Started!");
        System.out.println("  Cache metrics: http://localhost:8080/api/diagnostic/metrics");
        System.out.println("========================================\n");
    }
}
