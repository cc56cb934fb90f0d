package com.tablehub.gameservice.application.advice;

public record AdviceResult(String advice) {
}
