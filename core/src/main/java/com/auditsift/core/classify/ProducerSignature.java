package com.auditsift.core.classify;

import com.auditsift.core.model.ProducerType;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** 수집기 서명 (줄 시작 고정, 대소문자 무시). 먼저 맞는 것이 이긴다. */
enum ProducerSignature {
    NIX(ProducerType.KPNIXAUDIT, "^KPNIXVERSION: ([0-9.]+)"),
    WIN(ProducerType.KPWINAUDIT, "^System_PSDetails::KPWINVERSION: ([0-9.]+)"),
    MAC(ProducerType.KPMACAUDIT, "^KPMACVERSION: ([0-9.]+)");

    private final ProducerType producer;
    private final Pattern pattern;

    ProducerSignature(ProducerType producer, String regex) {
        this.producer = producer;
        this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    ProducerType producer() { return producer; }

    record Hit(ProducerType producer, String version) {}

    static Optional<Hit> detect(String line) {
        for (ProducerSignature sig : values()) {
            Matcher m = sig.pattern.matcher(line);
            if (m.find()) return Optional.of(new Hit(sig.producer, m.group(1)));
        }
        return Optional.empty();
    }
}
