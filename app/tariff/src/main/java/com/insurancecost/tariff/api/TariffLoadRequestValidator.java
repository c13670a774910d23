/*
 * どこで: Tariff 内部 API
 * 何を: 日付ごとの料率リストを検証し、登録用のレコード列へ変換する
 * なぜ: 不正な入力と同一日付内の貨物種別重複を DB へ到達する前に弾くため
 */
package com.insurancecost.tariff.api;

import com.insurancecost.tariff.api.request.PlainTariffRequest;
import com.insurancecost.tariff.model.TariffRecord;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class TariffLoadRequestValidator {

  private static final Logger logger = LoggerFactory.getLogger(TariffLoadRequestValidator.class);

  // 1 行あたり 3 つのバインド変数を使うため、PostgreSQL の上限 65535 に収まる件数で打ち切る
  static final int MAX_TARIFFS_PER_LOAD = 10_000;

  private final Validator validator;

  /**
   * @return ペイロードの出現順に並べた登録対象
   * @throws InvalidTariffRequestException 1 件でも違反がある場合 (全違反を含む)
   */
  public List<TariffRecord> validate(Map<LocalDate, List<PlainTariffRequest>> payload) {
    final List<String> errors = new ArrayList<>();
    if (payload == null || payload.isEmpty()) {
      errors.add("tariffs payload must not be empty");
      throw reject(errors);
    }
    final int total =
        payload.values().stream().mapToInt(plainTariffs -> plainTariffs == null ? 0 : plainTariffs.size()).sum();
    if (total > MAX_TARIFFS_PER_LOAD) {
      errors.add(
          "tariffs payload must contain at most " + MAX_TARIFFS_PER_LOAD + " tariffs, got " + total);
      throw reject(errors);
    }
    final List<TariffRecord> tariffs = new ArrayList<>();
    payload.forEach(
        (date, plainTariffs) -> {
          if (date == null) {
            errors.add("tariff date is required");
            return;
          }
          if (plainTariffs == null || plainTariffs.isEmpty()) {
            errors.add(date + ": tariff list must not be empty");
            return;
          }
          errors.addAll(validateEntries(date, plainTariffs));
          errors.addAll(findDuplicateCargoTypes(date, plainTariffs));
          for (PlainTariffRequest plainTariff : plainTariffs) {
            if (plainTariff != null && plainTariff.rate() != null) {
              tariffs.add(new TariffRecord(date, plainTariff.cargoType(), plainTariff.rate()));
            }
          }
        });
    if (!errors.isEmpty()) {
      throw reject(errors);
    }
    return tariffs;
  }

  private List<String> validateEntries(LocalDate date, List<PlainTariffRequest> plainTariffs) {
    final List<String> errors = new ArrayList<>();
    for (int i = 0; i < plainTariffs.size(); i++) {
      final PlainTariffRequest plainTariff = plainTariffs.get(i);
      final String location = date + "[" + i + "]";
      if (plainTariff == null) {
        errors.add(location + ": tariff is required");
        continue;
      }
      // 同一要素内のメッセージ順を安定させるため並べ替える
      validator.validate(plainTariff).stream()
          .map(ConstraintViolation::getMessage)
          .sorted()
          .forEach(message -> errors.add(location + ": " + message));
    }
    return errors;
  }

  private List<String> findDuplicateCargoTypes(
      LocalDate date, List<PlainTariffRequest> plainTariffs) {
    final Map<String, List<Integer>> indexesByCargoType = new LinkedHashMap<>();
    for (int i = 0; i < plainTariffs.size(); i++) {
      final PlainTariffRequest plainTariff = plainTariffs.get(i);
      if (plainTariff == null || plainTariff.cargoType() == null) {
        continue;
      }
      indexesByCargoType.computeIfAbsent(plainTariff.cargoType(), ignored -> new ArrayList<>()).add(i);
    }
    return indexesByCargoType.entrySet().stream()
        .filter(entry -> entry.getValue().size() > 1)
        .sorted(Comparator.comparing(entry -> entry.getValue().get(0)))
        .map(
            entry ->
                "tariffs for "
                    + date
                    + " at indexes "
                    + formatIndexes(entry.getValue())
                    + " share the same cargo type '"
                    + entry.getKey()
                    + "'")
        .toList();
  }

  private String formatIndexes(List<Integer> indexes) {
    final String head =
        indexes.subList(0, indexes.size() - 1).stream()
            .map(String::valueOf)
            .collect(Collectors.joining(", "));
    return head + " and " + indexes.get(indexes.size() - 1);
  }

  private InvalidTariffRequestException reject(List<String> errors) {
    logger.warn(
        "{} validation {} in the recent request:\n  {}",
        errors.size(),
        errors.size() == 1 ? "error" : "errors",
        String.join("\n  ", errors));
    return new InvalidTariffRequestException(errors);
  }
}
