package com.example.relay.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "relay.store")
@Validated
public record RelayStoreProperties(@DefaultValue("notifications.db") @NotBlank String path) {}
