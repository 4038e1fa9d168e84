package com.statusbridge.alertbridge.config;

import com.statusbridge.security.BasicCredentials;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Credentials the alerting source must present, bound from {@code statusbridge.webhook.*}.
 *
 * @param username basic auth user. Required.
 * @param password basic auth password. Required.
 * @param realm    realm announced in {@code WWW-Authenticate} (default {@code statusbridge})
 */
@ConfigurationProperties(prefix = "statusbridge.webhook")
@Validated
public record WebhookProperties(@NotBlank String username, @NotBlank String password, String realm) {

    public WebhookProperties {
        if (realm == null || realm.isBlank()) {
            realm = "statusbridge";
        }
    }

    public BasicCredentials credentials() {
        return new BasicCredentials(username, password);
    }

    @Override
    public String toString() {
        return "WebhookProperties[username=" + username + ", password=***, realm=" + realm + "]";
    }
}
