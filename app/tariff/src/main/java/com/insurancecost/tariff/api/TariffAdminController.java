/*
 * どこで: Tariff 内部 API
 * 何を: 料率の一括登録/更新/削除/参照のエンドポイントを提供する
 * なぜ: 運用側から料率表を保守できるようにするため
 */
package com.insurancecost.tariff.api;

import com.insurancecost.tariff.api.request.PlainTariffRequest;
import com.insurancecost.tariff.api.request.TariffKeyRequest;
import com.insurancecost.tariff.api.request.TariffRateUpdateRequest;
import com.insurancecost.tariff.api.response.SimpleResponse;
import com.insurancecost.tariff.api.response.TariffResponse;
import com.insurancecost.tariff.model.TariffRecord;
import com.insurancecost.tariff.service.TariffService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/internal/tariffs")
@RequiredArgsConstructor
@Validated
public class TariffAdminController {

    private static final String UPDATE_SUCCESS = "Success";

    private final TariffService tariffService;
    private final TariffLoadRequestValidator loadRequestValidator;

    /** 追加または料率が変わった行だけを返す。 */
    @PostMapping("/load")
    public List<TariffResponse> load(
            @RequestBody Map<LocalDate, List<PlainTariffRequest>> payload) {
        List<TariffRecord> tariffs = loadRequestValidator.validate(payload);
        return tariffService.upsert(tariffs).stream()
                .map(TariffResponse::from)
                .toList();
    }

    /** 料率が同じ場合と未登録の場合はどちらも 304 を返す。 */
    @PostMapping("/update")
    public ResponseEntity<SimpleResponse> update(@Valid @RequestBody TariffRateUpdateRequest request) {
        TariffRecord tariff = new TariffRecord(request.tariffDate(), request.cargoType(), request.newRate());
        return tariffService.edit(tariff)
                .map(updated -> ResponseEntity.ok(new SimpleResponse(UPDATE_SUCCESS)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_MODIFIED).build());
    }

    @PostMapping("/delete")
    public TariffResponse delete(@Valid @RequestBody TariffKeyRequest request) {
        return tariffService.delete(request.tariffDate(), request.cargoType())
                .map(TariffResponse::from)
                .orElseThrow(() -> new TariffNotFoundException(request.tariffDate(), request.cargoType()));
    }

    @GetMapping("/{date}/{cargo_type}")
    public TariffResponse fetch(
            @PathVariable("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @PathVariable("cargo_type")
            @NotBlank(message = "cargo_type is required")
            @Size(max = 50, message = "cargo_type must be at most 50 characters")
            String cargoType) {
        return tariffService.fetch(date, cargoType)
                .map(TariffResponse::from)
                .orElseThrow(() -> new TariffNotFoundException(date, cargoType));
    }
}
