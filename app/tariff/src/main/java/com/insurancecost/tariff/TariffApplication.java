/*
 * どこで: Tariff アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: 設定クラスと監査 flush のスケジュールをまとめて有効化するため
 */
package com.insurancecost.tariff;

import com.insurancecost.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class TariffApplication {

    public static void main(String[] args) {
        SpringApplication.run(TariffApplication.class, args);
    }
}
