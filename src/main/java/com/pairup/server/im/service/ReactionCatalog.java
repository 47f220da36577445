package com.pairup.server.im.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Component
public class ReactionCatalog {

    private final Set<String> codes;

    public ReactionCatalog(@Value("${messaging.reaction-codes:like,laugh,clap,heart,wow}") List<String> codes) {
        this.codes = codes.stream().map(String::trim).filter(c -> !c.isEmpty()).collect(Collectors.toUnmodifiableSet());
    }

    public boolean contains(String code) {
        return code != null && codes.contains(code);
    }

    public Set<String> getCodes() {
        return codes;
    }
}
