package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One authentication attempt as seen by the gateway, already annotated with
 * location and connection-type flags.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AuthAttempt {

    @JsonProperty("email")
    private String email;

    @JsonProperty("clientIP")
    private String clientIp;

    @JsonProperty("userAgent")
    private String userAgent;

    @JsonProperty("timestamp")
    private Instant timestamp;

    @JsonProperty("requestId")
    private String requestId;

    @JsonProperty("geolocation")
    private GeoLocation geolocation;

    @JsonProperty("isTor")
    private boolean tor;

    @JsonProperty("isVpn")
    private boolean vpn;

    /**
     * Hash of the submitted credential, used only for pattern checks
     */
    @JsonProperty("passwordHash")
    private String passwordHash;

    @JsonProperty("loginSucceeded")
    private boolean loginSucceeded;

    public AuthAttempt() {
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getClientIp() {
        return clientIp;
    }

    public void setClientIp(String clientIp) {
        this.clientIp = clientIp;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public GeoLocation getGeolocation() {
        return geolocation;
    }

    public void setGeolocation(GeoLocation geolocation) {
        this.geolocation = geolocation;
    }

    public boolean isTor() {
        return tor;
    }

    public void setTor(boolean tor) {
        this.tor = tor;
    }

    public boolean isVpn() {
        return vpn;
    }

    public void setVpn(boolean vpn) {
        this.vpn = vpn;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public void setPasswordHash(String passwordHash) {
        this.passwordHash = passwordHash;
    }

    public boolean isLoginSucceeded() {
        return loginSucceeded;
    }

    public void setLoginSucceeded(boolean loginSucceeded) {
        this.loginSucceeded = loginSucceeded;
    }

    public static class Builder {
        private final AuthAttempt attempt;

        public Builder() {
            this.attempt = new AuthAttempt();
        }

        public Builder email(String email) {
            attempt.email = email;
            return this;
        }

        public Builder clientIp(String clientIp) {
            attempt.clientIp = clientIp;
            return this;
        }

        public Builder userAgent(String userAgent) {
            attempt.userAgent = userAgent;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            attempt.timestamp = timestamp;
            return this;
        }

        public Builder requestId(String requestId) {
            attempt.requestId = requestId;
            return this;
        }

        public Builder geolocation(GeoLocation geolocation) {
            attempt.geolocation = geolocation;
            return this;
        }

        public Builder tor(boolean tor) {
            attempt.tor = tor;
            return this;
        }

        public Builder vpn(boolean vpn) {
            attempt.vpn = vpn;
            return this;
        }

        public Builder passwordHash(String passwordHash) {
            attempt.passwordHash = passwordHash;
            return this;
        }

        public Builder loginSucceeded(boolean loginSucceeded) {
            attempt.loginSucceeded = loginSucceeded;
            return this;
        }

        public AuthAttempt build() {
            return attempt;
        }
    }
}
