/*
 * どこで: Tariff データアクセス
 * 何を: tariffs の参照/upsert/料率更新/削除を 1 文ずつ発行する
 * なぜ: 同一キーへの同時更新の直列化を DB の競合解決に任せるため
 */
package com.insurancecost.tariff.repository;

import static com.insurancecost.common.JdbcDateUtils.toLocalDate;
import static com.insurancecost.common.JdbcDateUtils.toSqlDate;

import com.insurancecost.tariff.model.TariffRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class TariffRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<TariffRecord> findByKey(LocalDate date, String cargoType) {
    final String sql =
        """
        SELECT date, cargo_type, rate
        FROM tariffs
        WHERE date = :date
          AND cargo_type = :cargoType
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("date", toSqlDate(date))
            .addValue("cargoType", cargoType);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * 未登録の行は追加し、料率が異なる既存行だけ更新する。
   *
   * @return 追加または料率が変わった行のみ。同じ料率の既存行は含まない
   */
  public List<TariffRecord> upsertAll(List<TariffRecord> tariffs) {
    if (tariffs == null || tariffs.isEmpty()) {
      throw new IllegalArgumentException("tariffs must not be empty");
    }
    // 同一文内で同じキーを 2 回更新すると PostgreSQL がエラーにするため、呼び出し側で一意性を保証する
    final String sql =
        """
        INSERT INTO tariffs (date, cargo_type, rate)
        VALUES :rows
        ON CONFLICT ON CONSTRAINT unique_date_cargo_type
        DO UPDATE SET rate = EXCLUDED.rate
        WHERE tariffs.rate <> EXCLUDED.rate
        RETURNING date, cargo_type, rate
        """;
    final List<Object[]> rows =
        tariffs.stream()
            .map(tariff -> new Object[] {toSqlDate(tariff.date()), tariff.cargoType(), tariff.rate()})
            .toList();
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("rows", rows);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public Optional<TariffRecord> updateRateIfChanged(TariffRecord tariff) {
    // 行が無い場合と料率が同じ場合はどちらも空結果になる
    final String sql =
        """
        UPDATE tariffs
        SET rate = :rate
        WHERE date = :date
          AND cargo_type = :cargoType
          AND rate <> :rate
        RETURNING date, cargo_type, rate
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("date", toSqlDate(tariff.date()))
            .addValue("cargoType", tariff.cargoType())
            .addValue("rate", tariff.rate());
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<TariffRecord> deleteByKey(LocalDate date, String cargoType) {
    final String sql =
        """
        DELETE FROM tariffs
        WHERE date = :date
          AND cargo_type = :cargoType
        RETURNING date, cargo_type, rate
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("date", toSqlDate(date))
            .addValue("cargoType", cargoType);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private TariffRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new TariffRecord(
        toLocalDate(rs.getDate("date")), rs.getString("cargo_type"), rs.getDouble("rate"));
  }
}
