/*
 * どこで: Tariff アプリの起動処理
 * 何を: 起動完了時に DB 接続を確認し、接続先をパスワード抜きでログに残す
 * なぜ: 接続設定の誤りを最初のリクエストより前に検知するため
 */
package com.insurancecost.tariff.config;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.regex.Pattern;
import javax.sql.DataSource;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DatabaseConnectivityCheck {

  private static final Logger logger = LoggerFactory.getLogger(DatabaseConnectivityCheck.class);
  private static final Pattern PASSWORD_PARAMETER =
      Pattern.compile("(?i)(password=)[^&;]*");
  private static final Pattern USER_INFO = Pattern.compile("//([^/@:]+):[^/@]*@");

  private final DataSource dataSource;

  @EventListener(ApplicationReadyEvent.class)
  public void verify() {
    try (Connection connection = dataSource.getConnection()) {
      final String url = redact(connection.getMetaData().getURL());
      logger.info("connection to the database can be established successfully url={}", url);
    } catch (SQLException ex) {
      throw new IllegalStateException("failed to connect to the database", ex);
    }
  }

  static String redact(String jdbcUrl) {
    if (jdbcUrl == null) {
      return null;
    }
    final String withoutUserInfo = USER_INFO.matcher(jdbcUrl).replaceAll("//$1:***@");
    return PASSWORD_PARAMETER.matcher(withoutUserInfo).replaceAll("$1***");
  }
}
