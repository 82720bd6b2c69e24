package br.com.may.features.billing.api.dto;

public record TokenizeCardResponse(String token, String brand, String lastFour) {}
