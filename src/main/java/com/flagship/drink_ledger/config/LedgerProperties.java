package com.flagship.drink_ledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings under the {@code ledger} prefix.
 */
@ConfigurationProperties(prefix = "ledger")
@Getter
@Setter
public class LedgerProperties {

    /**
     * Price of a drink in cents.
     */
    private long drinkPriceCents = 100;

    /**
     * Random bytes in a generated prepaid user key before URL-safe encoding.
     */
    private int userKeyBytes = 6;

    private Groups groups = new Groups();

    private Identity identity = new Identity();

    private Store store = new Store();

    private Postpaid postpaid = new Postpaid();

    @Getter
    @Setter
    public static class Groups {
        private String member = "drinks-members";
        private String admin = "drinks-admins";
    }

    @Getter
    @Setter
    public static class Identity {
        private String userHeader = "X-Forwarded-User";
        private String groupsHeader = "X-Forwarded-Groups";
        private String loginUrl = "/login";
        /**
         * Remote addresses allowed to set the identity headers. Empty trusts
         * every peer, which is only safe when the proxy is the sole route in
         * and strips client-sent copies of the headers.
         */
        private List<String> trustedProxies = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Store {
        /**
         * {@code jdbc} or {@code memory}.
         */
        private String type = "jdbc";
    }

    @Getter
    @Setter
    public static class Postpaid {
        /**
         * Whether postpaid users created on first login may drink right away.
         */
        private boolean activatedOnCreate = false;
    }
}
