package com.portfoliodevs.notifier.service;

public class SendOutcome {

    private final boolean success;
    private final String detail;

    private SendOutcome(boolean success, String detail) {
        this.success = success;
        this.detail = detail;
    }

    public static SendOutcome success(String detail) {
        return new SendOutcome(true, detail);
    }

    public static SendOutcome failure(String detail) {
        return new SendOutcome(false, detail);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return (success ? "success" : "failure") + ": " + detail;
    }
}
