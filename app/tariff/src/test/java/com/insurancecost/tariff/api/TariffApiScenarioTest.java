/*
 * どこで: Tariff API の結合テスト
 * 何を: 登録 -> 評価 -> 更新 -> 評価 -> 削除 -> 評価 の一連の HTTP 操作を検証する
 * なぜ: コントローラ/サービス/DB を通した保険料の計算結果を保証するため
 */
package com.insurancecost.tariff.api;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.insurancecost.tariff.AbstractPostgresContainerTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class TariffApiScenarioTest extends AbstractPostgresContainerTest {

  private static final String EVALUATE_BODY =
      """
      {"insurance_date":"2024-01-01","cargo_type":"electronics","declared_price":200}
      """;

  @Autowired private MockMvc mockMvc;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM tariffs", new MapSqlParameterSource());
  }

  @Test
  void evaluatedCostFollowsTariffChanges() throws Exception {
    postJson(
            "/api/internal/tariffs/load",
            """
            {"2024-01-01":[{"cargo_type":"electronics","rate":1.5}]}
            """)
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].cargo_type").value("electronics"));

    postJson("/api/public/evaluate_cost", EVALUATE_BODY)
        .andExpect(status().isOk())
        .andExpect(content().string("300.0"));

    postJson(
            "/api/internal/tariffs/update",
            """
            {"tariff_date":"2024-01-01","cargo_type":"electronics","new_rate":2.0}
            """)
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.detail").value("Success"));

    postJson("/api/public/evaluate_cost", EVALUATE_BODY)
        .andExpect(status().isOk())
        .andExpect(content().string("400.0"));

    postJson(
            "/api/internal/tariffs/delete",
            """
            {"tariff_date":"2024-01-01","cargo_type":"electronics"}
            """)
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.rate").value(2.0));

    postJson("/api/public/evaluate_cost", EVALUATE_BODY)
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("TARIFF_NOT_FOUND"));
  }

  @Test
  void repeatedLoadAndUnchangedUpdateReportNoChange() throws Exception {
    final String load =
        """
        {"2024-01-01":[{"cargo_type":"glass","rate":0.04}]}
        """;
    postJson("/api/internal/tariffs/load", load).andExpect(jsonPath("$.length()").value(1));
    postJson("/api/internal/tariffs/load", load).andExpect(jsonPath("$.length()").value(0));

    postJson(
            "/api/internal/tariffs/update",
            """
            {"tariff_date":"2024-01-01","cargo_type":"glass","new_rate":0.04}
            """)
        .andExpect(status().isNotModified());

    mockMvc
        .perform(get("/api/internal/tariffs/2024-01-01/glass"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.rate").value(0.04));
  }

  private ResultActions postJson(String path, String body) throws Exception {
    return mockMvc.perform(post(path).contentType(MediaType.APPLICATION_JSON).content(body));
  }
}
