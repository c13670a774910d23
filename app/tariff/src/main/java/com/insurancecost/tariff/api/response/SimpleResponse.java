package com.insurancecost.tariff.api.response;

public record SimpleResponse(String detail) {}
