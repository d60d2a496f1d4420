package io.generativeai.core.response;

public record ModalityTokenCount(Modality modality, Integer tokenCount) {
}
