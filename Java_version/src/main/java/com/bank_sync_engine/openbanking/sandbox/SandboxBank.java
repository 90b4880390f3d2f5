package com.bank_sync_engine.openbanking.sandbox;

import com.bank_sync_engine.config.OpenBankingProperties;
import com.bank_sync_engine.exception.AuthException;
import com.bank_sync_engine.exception.InvalidGrantException;
import com.bank_sync_engine.exception.ValidationException;
import com.bank_sync_engine.openbanking.AuthorizationUrls;
import com.bank_sync_engine.openbanking.ConsentGrant;
import com.bank_sync_engine.openbanking.dto.ObAccountsResponse;
import com.bank_sync_engine.openbanking.dto.ObAmount;
import com.bank_sync_engine.openbanking.dto.ObTransaction;
import com.bank_sync_engine.openbanking.dto.ObTransactionPage;
import com.bank_sync_engine.vault.TokenSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory bank simulator behind the sandbox connector and gateway. Consents and tokens live in
 * memory; accounts and transactions are derived from seeds so the same window always yields the
 * same external ids and amounts.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "open-banking", name = "mode", havingValue = "sandbox", matchIfMissing = true)
public class SandboxBank {

    public static final String CODE_PREFIX = "sandbox-auth-";
    static final String ACCESS_PREFIX = "sandbox-access-";
    static final String REFRESH_PREFIX = "sandbox-refresh-";
    static final long TOKEN_TTL_SECONDS = 3600;
    static final Duration CODE_TTL = Duration.ofMinutes(10);
    static final Duration USED_CODE_RETENTION = Duration.ofHours(24);
    static final Duration REFRESH_TTL = Duration.ofDays(90);
    static final int PAGE_SIZE = 25;

    private static final DateTimeFormatter DAY = DateTimeFormatter.BASIC_ISO_DATE;

    // code, direction, description
    private static final String[][] TEMPLATES = {
            {"PIX_RECEBIDO", "CREDIT", "PIX recebido"},
            {"PIX_ENVIADO", "DEBIT", "PIX enviado"},
            {"TED_RECEBIDO", "CREDIT", "TED recebida"},
            {"TED_ENVIADO", "DEBIT", "TED enviada"},
            {"COMPRA_CARTAO", "DEBIT", "Compra no cartao"},
            {"SAQUE", "DEBIT", "Saque em dinheiro"},
            {"DEPOSITO", "CREDIT", "Deposito"},
            {"TARIFA", "DEBIT", "Tarifa bancaria"},
            {"RENDIMENTO", "CREDIT", "Rendimento da conta"},
    };

    private record Consent(String providerCode, Instant expiresAt) {}

    private record PendingCode(String providerCode, Instant expiresAt) {}

    private record IssuedToken(String providerCode, Instant expiresAt) {}

    // the access token issued alongside is revoked when this refresh token is used
    private record IssuedRefresh(String providerCode, String accessToken, Instant expiresAt) {}

    private final Map<String, Consent> consents = new ConcurrentHashMap<>();
    private final Map<String, PendingCode> pendingCodes = new ConcurrentHashMap<>();
    private final Map<String, Instant> usedCodes = new ConcurrentHashMap<>();
    private final Map<String, IssuedToken> accessTokens = new ConcurrentHashMap<>();
    private final Map<String, IssuedRefresh> refreshTokens = new ConcurrentHashMap<>();

    private final OpenBankingProperties props;
    private final Clock clock;

    public SandboxBank(OpenBankingProperties props, Clock clock) {
        this.props = props;
        this.clock = clock;
    }

    public ConsentGrant createConsent(String providerCode, List<String> permissions) {
        String consentId = "sandbox-consent-" + UUID.randomUUID();
        consents.put(consentId, new Consent(providerCode, clock.instant().plus(props.getConsentTtl())));

        String state = UUID.randomUUID().toString();
        String nonce = UUID.randomUUID().toString();
        String endpoint = props.getSandboxBaseUrl() + "/" + providerCode + "/oauth/authorize";
        String url = AuthorizationUrls.build(endpoint, props, permissions, consentId, state, nonce);
        log.info("Sandbox consent {} created for provider {}", consentId, providerCode);
        return new ConsentGrant(consentId, url, state, nonce, props.getConsentTtl().toSeconds());
    }

    /** Simulated user approval. Returns a one-time authorization code. */
    public String authorize(String providerCode, String consentId) {
        Consent consent = consents.remove(consentId);
        if (consent == null || !consent.providerCode().equals(providerCode)) {
            throw new InvalidGrantException("Unknown sandbox consent " + consentId);
        }
        if (clock.instant().isAfter(consent.expiresAt())) {
            throw new InvalidGrantException("Sandbox consent " + consentId + " expired");
        }
        String code = CODE_PREFIX + UUID.randomUUID();
        pendingCodes.put(code, new PendingCode(providerCode, clock.instant().plus(CODE_TTL)));
        return code;
    }

    public TokenSet exchange(String code, String providerCode) {
        if (code == null || !code.startsWith(CODE_PREFIX)) {
            throw new InvalidGrantException("Invalid authorization code format");
        }
        Instant now = clock.instant();
        if (usedCodes.putIfAbsent(code, now.plus(USED_CODE_RETENTION)) != null) {
            throw new InvalidGrantException("Authorization code already used");
        }
        PendingCode pending = pendingCodes.remove(code);
        if (pending != null && !pending.providerCode().equals(providerCode)) {
            throw new InvalidGrantException("Authorization code was issued for another provider");
        }
        if (pending != null && now.isAfter(pending.expiresAt())) {
            throw new InvalidGrantException("Authorization code expired");
        }
        return issueTokens(providerCode);
    }

    /** Rotating refresh: the presented refresh token and the access token issued with it are revoked. */
    public TokenSet refresh(String refreshToken, String providerCode) {
        IssuedRefresh issued = refreshTokens.remove(refreshToken == null ? "" : refreshToken);
        if (issued == null || !issued.providerCode().equals(providerCode)) {
            throw new InvalidGrantException("Unknown or already used sandbox refresh token");
        }
        accessTokens.remove(issued.accessToken());
        if (clock.instant().isAfter(issued.expiresAt())) {
            throw new InvalidGrantException("Sandbox refresh token expired");
        }
        return issueTokens(providerCode);
    }

    public ObAccountsResponse accounts(String accessToken, String providerCode) {
        requireToken(accessToken, providerCode);
        Random random = new Random(providerCode.hashCode());
        BigDecimal balance = BigDecimal.valueOf(1000 + random.nextInt(149_000) + random.nextInt(100) / 100.0)
                .setScale(2, RoundingMode.HALF_UP);
        BigDecimal available = balance.multiply(BigDecimal.valueOf(0.9)).setScale(2, RoundingMode.HALF_UP);
        String number = String.format("%06d", random.nextInt(1_000_000));
        String agency = String.format("%04d", random.nextInt(10_000));

        ObAccountsResponse.Account account = new ObAccountsResponse.Account(
                accountId(providerCode), "checking", providerCode, agency, number,
                String.valueOf(random.nextInt(10)), "BRL",
                balance.toPlainString(), available.toPlainString(), "AVAILABLE");
        return new ObAccountsResponse(List.of(account));
    }

    public ObTransactionPage transactions(String accessToken, String providerCode, String accountId,
                                          LocalDate from, LocalDate to, int page) {
        requireToken(accessToken, providerCode);
        if (!accountId(providerCode).equals(accountId)) {
            throw new ValidationException("Unknown sandbox account " + accountId);
        }
        if (from.isAfter(to)) {
            throw new ValidationException("fromBookingDate is after toBookingDate");
        }
        List<ObTransaction> all = generate(accountId, from, to);
        int totalPages = Math.max(1, (all.size() + PAGE_SIZE - 1) / PAGE_SIZE);
        int start = Math.min(all.size(), (page - 1) * PAGE_SIZE);
        int end = Math.min(all.size(), start + PAGE_SIZE);
        return new ObTransactionPage(
                all.subList(start, end),
                new ObTransactionPage.Links(null, null),
                new ObTransactionPage.Meta(all.size(), totalPages));
    }

    static String accountId(String providerCode) {
        return "sandbox-account-" + providerCode;
    }

    // Zero to two transactions per day, seeded by (account, day)
    static List<ObTransaction> generate(String accountId, LocalDate from, LocalDate to) {
        List<ObTransaction> out = new ArrayList<>();
        for (LocalDate day = to; !day.isBefore(from); day = day.minusDays(1)) {
            Random random = new Random(31L * accountId.hashCode() + day.toEpochDay());
            int count = random.nextInt(3);
            for (int n = 0; n < count; n++) {
                String[] template = TEMPLATES[random.nextInt(TEMPLATES.length)];
                boolean credit = "CREDIT".equals(template[1]);
                BigDecimal amount = amountFor(template[0], random);
                String booked = day.atTime(8 + random.nextInt(12), random.nextInt(60))
                        .atOffset(ZoneOffset.UTC).toString();
                BigDecimal balanceAfter = BigDecimal.valueOf(1000 + random.nextInt(49_000)).setScale(2, RoundingMode.HALF_UP);

                out.add(new ObTransaction(
                        "sandbox-tx-" + accountId.substring(accountId.lastIndexOf('-') + 1) + "-" + day.format(DAY) + "-" + n,
                        template[0],
                        template[1],
                        new ObAmount(amount.toPlainString(), "BRL"),
                        booked,
                        template[2],
                        credit ? null : "Beneficiario Sandbox",
                        credit ? "Pagador Sandbox" : null,
                        null,
                        template[2] + " - Transacao sandbox",
                        template[0],
                        new ObAmount(balanceAfter.toPlainString(), "BRL"),
                        "TRANSACAO_EFETIVADA"));
            }
        }
        return out;
    }

    private static BigDecimal amountFor(String code, Random random) {
        double value = switch (code) {
            case "PIX_RECEBIDO", "PIX_ENVIADO" -> 10 + random.nextDouble() * 1990;
            case "COMPRA_CARTAO" -> 15 + random.nextDouble() * 485;
            case "SAQUE" -> 50 + random.nextDouble() * 950;
            case "TARIFA" -> 5 + random.nextDouble() * 45;
            default -> 100 + random.nextDouble() * 4900;
        };
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP);
    }

    private TokenSet issueTokens(String providerCode) {
        String access = ACCESS_PREFIX + UUID.randomUUID();
        String refresh = REFRESH_PREFIX + UUID.randomUUID();
        Instant now = clock.instant();
        accessTokens.put(access, new IssuedToken(providerCode, now.plusSeconds(TOKEN_TTL_SECONDS)));
        refreshTokens.put(refresh, new IssuedRefresh(providerCode, access, now.plus(REFRESH_TTL)));
        return new TokenSet(access, refresh, TOKEN_TTL_SECONDS, "Bearer", String.join(" ", props.getScopes()));
    }

    private void requireToken(String accessToken, String providerCode) {
        IssuedToken token = accessToken == null ? null : accessTokens.get(accessToken);
        if (token == null || !token.providerCode().equals(providerCode)) {
            throw new AuthException("Invalid sandbox access token");
        }
        if (clock.instant().isAfter(token.expiresAt())) {
            throw new AuthException("Sandbox access token expired");
        }
    }

    @Scheduled(fixedDelay = 15 * 60 * 1000L)
    public void purgeExpired() {
        Instant now = clock.instant();
        consents.values().removeIf(c -> now.isAfter(c.expiresAt()));
        pendingCodes.values().removeIf(c -> now.isAfter(c.expiresAt()));
        usedCodes.values().removeIf(now::isAfter);
        accessTokens.values().removeIf(t -> now.isAfter(t.expiresAt()));
        refreshTokens.values().removeIf(r -> now.isAfter(r.expiresAt()));
    }

    int trackedEntries() {
        return consents.size() + pendingCodes.size() + usedCodes.size() + accessTokens.size() + refreshTokens.size();
    }
}
