/*
 * どこで: Tariff 公開 API
 * 何を: 保険料評価のエンドポイントを提供する
 * なぜ: 料率 x 申告価格の計算を外部へ公開するため
 */
package com.insurancecost.tariff.api;

import com.insurancecost.tariff.api.request.EvaluateCostRequest;
import com.insurancecost.tariff.service.TariffService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/public")
@RequiredArgsConstructor
public class CostEvaluationController {

    private final TariffService tariffService;

    /** 料率が未登録の場合は 404 を返す。 */
    @PostMapping("/evaluate_cost")
    public double evaluateCost(@Valid @RequestBody EvaluateCostRequest request) {
        return tariffService.evaluateCost(
                request.insuranceDate(),
                request.cargoType(),
                request.declaredPrice());
    }
}
