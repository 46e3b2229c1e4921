package com.portfoliodevs.notifier.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WhatsAppRequest {

    @NotBlank(message = "Phone number is required")
    @Pattern(regexp = "^(whatsapp:)?\\+[0-9]{6,15}$", message = "Phone number must be in international format, e.g. +51987654321")
    private String phoneNumber;

    @NotBlank(message = "Message is required")
    private String message;
}
