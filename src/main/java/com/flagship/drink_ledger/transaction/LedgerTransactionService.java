package com.flagship.drink_ledger.transaction;

import com.flagship.drink_ledger.authz.AuthorizationPolicy;
import com.flagship.drink_ledger.authz.LedgerOperation;
import com.flagship.drink_ledger.authz.LedgerPrincipal;
import com.flagship.drink_ledger.ledger.DrinkType;
import com.flagship.drink_ledger.ledger.PostpaidUser;
import com.flagship.drink_ledger.ledger.PrepaidUser;
import com.flagship.drink_ledger.ledger.UserKind;
import com.flagship.drink_ledger.ledger.exception.ConflictException;
import com.flagship.drink_ledger.ledger.exception.ForbiddenException;
import com.flagship.drink_ledger.ledger.exception.InactiveException;
import com.flagship.drink_ledger.ledger.exception.NotFoundException;
import com.flagship.drink_ledger.ledger.exception.UnauthorizedException;
import com.flagship.drink_ledger.observability.CorrelationContext;
import com.flagship.drink_ledger.observability.LedgerMetrics;
import com.flagship.drink_ledger.store.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;

/**
 * Executes every money- and state-mutating ledger operation.
 *
 * Each operation follows the same discipline:
 * 1. Authorization gate (group membership)
 * 2. Per-record locks, always acquired in sorted key order
 * 3. One store transaction that performs all existence, ownership and
 *    activation checks before the first write
 *
 * Policy constants:
 * - No balance floor: postpaid and prepaid balances may go negative.
 * - Deactivation blocks drink purchases only; balances stay viewable and
 *   can still be topped up, overridden or settled.
 */
@Slf4j
public class LedgerTransactionService {

    private static final int USER_KEY_ATTEMPTS = 10;

    private final LedgerStore store;
    private final AuthorizationPolicy policy;
    private final KeyedLocks locks;
    private final UserKeyGenerator keyGenerator;
    private final LedgerMetrics metrics;
    private final Clock clock;
    private final boolean activateNewPostpaidUsers;

    public LedgerTransactionService(LedgerStore store,
                                    AuthorizationPolicy policy,
                                    KeyedLocks locks,
                                    UserKeyGenerator keyGenerator,
                                    LedgerMetrics metrics,
                                    Clock clock,
                                    boolean activateNewPostpaidUsers) {
        this.store = store;
        this.policy = policy;
        this.locks = locks;
        this.keyGenerator = keyGenerator;
        this.metrics = metrics;
        this.clock = clock;
        this.activateNewPostpaidUsers = activateNewPostpaidUsers;
    }

    // ==================== Drinks ====================

    /**
     * Books a drink on the selected account.
     *
     * @param actor the logged in principal; may be null for {@link DrinkTarget.Kind#PREPAID_BY_KEY}
     * @param target whose balance is charged
     * @param priceCents non-negative price in cents
     * @param drinkTypeId optional catalog entry whose counters are updated as well
     * @throws NotFoundException if the account, key or drink type is unknown
     * @throws InactiveException if the account is deactivated
     */
    public DrinkReceipt recordDrink(LedgerPrincipal actor, DrinkTarget target, long priceCents, Integer drinkTypeId) {
        if (priceCents < 0) {
            throw new IllegalArgumentException("Drink price must not be negative");
        }

        long startTime = System.currentTimeMillis();
        try {
            DrinkReceipt receipt = switch (target.getKind()) {
                case SELF_POSTPAID -> {
                    gate(actor, LedgerOperation.RECORD_DRINK);
                    yield drinkPostpaid(actor.getUsername(), priceCents, drinkTypeId);
                }
                case SELF_PREPAID -> {
                    gate(actor, LedgerOperation.RECORD_DRINK);
                    // Only a prepaid user owned by the actor's own account counts as "self"
                    long ownerId = store.findPostpaid(actor.getUsername())
                        .map(PostpaidUser::getId)
                        .orElseThrow(() -> new NotFoundException("Prepaid user not found: " + actor.getUsername()));
                    yield drinkPrepaid(actor.getUsername(), null, ownerId, priceCents, drinkTypeId);
                }
                case PREPAID_BY_KEY -> {
                    gate(actor, LedgerOperation.RECORD_DRINK_BY_KEY);
                    // Resolve the key first; the locked re-read below verifies it is still current
                    PrepaidUser keyHolder = store.findPrepaidByKey(target.getUserKey())
                        .orElseThrow(() -> new NotFoundException("Unknown user key"));
                    yield drinkPrepaid(keyHolder.getUsername(), target.getUserKey(), null, priceCents, drinkTypeId);
                }
            };

            metrics.recordDrink(receipt.getUserKind().name().toLowerCase());
            log.info("Drink booked: user={}, type={}, price={}, moneyAfter={}",
                receipt.getUsername(), receipt.getUserKind(), priceCents, receipt.getMoneyAfter());
            return receipt;
        } catch (InactiveException e) {
            metrics.recordDrinkRejected("inactive");
            throw e;
        } catch (NotFoundException e) {
            metrics.recordDrinkRejected("not_found");
            throw e;
        } finally {
            metrics.recordLatency("drink", System.currentTimeMillis() - startTime);
        }
    }

    private DrinkReceipt drinkPostpaid(String username, long priceCents, Integer drinkTypeId) {
        return locked(drinkLocks(KeyedLocks.postpaidKey(username), drinkTypeId), () -> {
            PostpaidUser user = store.getPostpaid(username);
            if (!user.isActivated()) {
                throw new InactiveException("Postpaid user not activated: " + username);
            }
            DrinkType drinkType = loadDrinkType(drinkTypeId);

            Instant now = clock.instant();
            PostpaidUser updated = store.upsertPostpaid(user.drink(priceCents, now));
            consume(drinkType);
            return new DrinkReceipt(UserKind.POSTPAID, username, priceCents, updated.getMoney(), now, drinkTypeId);
        });
    }

    /**
     * @param expectedKey if set, the locked record must still carry this key
     * @param expectedOwnerId if set, the locked record must belong to this postpaid account
     */
    private DrinkReceipt drinkPrepaid(String username, String expectedKey, Long expectedOwnerId,
                                      long priceCents, Integer drinkTypeId) {
        return locked(drinkLocks(KeyedLocks.prepaidKey(username), drinkTypeId), () -> {
            PrepaidUser user = store.findPrepaid(username)
                .filter(found -> expectedKey == null || found.getUserKey().equals(expectedKey))
                .filter(found -> expectedOwnerId == null || found.getPostpaidUserId() == expectedOwnerId)
                .orElseThrow(() -> new NotFoundException(
                    expectedKey == null ? "Prepaid user not found: " + username : "Unknown user key"));
            if (!user.isActivated()) {
                throw new InactiveException("Prepaid user not activated: " + username);
            }
            DrinkType drinkType = loadDrinkType(drinkTypeId);

            Instant now = clock.instant();
            PrepaidUser updated = store.upsertPrepaid(user.drink(priceCents, now));
            consume(drinkType);
            return new DrinkReceipt(UserKind.PREPAID, username, priceCents, updated.getMoney(), now, drinkTypeId);
        });
    }

    private List<String> drinkLocks(String userKey, Integer drinkTypeId) {
        List<String> keys = new ArrayList<>();
        keys.add(userKey);
        if (drinkTypeId != null) {
            keys.add(KeyedLocks.drinkTypeKey(drinkTypeId));
        }
        return keys;
    }

    private DrinkType loadDrinkType(Integer drinkTypeId) {
        if (drinkTypeId == null) {
            return null;
        }
        return store.findDrinkType(drinkTypeId)
            .orElseThrow(() -> new NotFoundException("Drink type not found: " + drinkTypeId));
    }

    private void consume(DrinkType drinkType) {
        if (drinkType != null) {
            store.updateDrinkType(drinkType.consume());
        }
    }

    // ==================== Accounts ====================

    /**
     * Returns the actor's postpaid account, creating it on the first visit.
     */
    public PostpaidUser ensurePostpaidUser(LedgerPrincipal actor) {
        gate(actor, LedgerOperation.ENSURE_ACCOUNT);
        String username = actor.getUsername();

        return locked(List.of(KeyedLocks.postpaidKey(username)), () ->
            store.findPostpaid(username).orElseGet(() -> {
                PostpaidUser created = store.upsertPostpaid(
                    PostpaidUser.create(username, activateNewPostpaidUsers));
                log.info("Created postpaid user {} on first login (activated={})",
                    username, created.isActivated());
                return created;
            }));
    }

    /**
     * The actor's own account plus, for members, the prepaid users they own.
     */
    public AccountOverview accountOverview(LedgerPrincipal actor) {
        PostpaidUser account = ensurePostpaidUser(actor);
        List<PrepaidUser> prepaidUsers = policy.isMember(actor)
            ? store.listPrepaidByOwner(account.getId())
            : List.of();
        return new AccountOverview(account, prepaidUsers);
    }

    public List<PrepaidUser> listOwnPrepaidUsers(LedgerPrincipal actor) {
        gate(actor, LedgerOperation.VIEW_OWN_PREPAID);
        PostpaidUser owner = store.getPostpaid(actor.getUsername());
        return store.listPrepaidByOwner(owner.getId());
    }

    // ==================== Prepaid users ====================

    /**
     * Creates a prepaid user owned by the actor, with a fresh user key.
     *
     * @throws ConflictException if the username is already taken among prepaid users
     * @throws NotFoundException if the actor has no postpaid account yet
     */
    public PrepaidUser addPrepaidUser(LedgerPrincipal actor, String username, long startMoneyCents) {
        gate(actor, LedgerOperation.ADD_PREPAID_USER);
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username is required");
        }

        List<String> keys = List.of(KeyedLocks.postpaidKey(actor.getUsername()), KeyedLocks.prepaidKey(username));
        return locked(keys, () -> {
            PostpaidUser owner = store.getPostpaid(actor.getUsername());
            if (store.findPrepaid(username).isPresent()) {
                throw new ConflictException("Prepaid user already exists: " + username);
            }

            PrepaidUser created = store.upsertPrepaid(
                PrepaidUser.create(username, freshUserKey(), owner.getId(), startMoneyCents));
            log.info("Prepaid user {} created by {} with start money {}",
                username, actor.getUsername(), startMoneyCents);
            return created;
        });
    }

    /**
     * Adds (or, for a negative amount, removes) money on a prepaid user.
     * Allowed for the owning member and for administrators.
     */
    public PrepaidUser addMoneyPrepaid(LedgerPrincipal actor, String targetUsername, long amountCents) {
        gate(actor, LedgerOperation.ADD_MONEY_PREPAID);

        return locked(List.of(KeyedLocks.prepaidKey(targetUsername)), () -> {
            PrepaidUser target = store.getPrepaid(targetUsername);
            if (!policy.isAdmin(actor)) {
                boolean owns = store.findPostpaid(actor.getUsername())
                    .map(target::isOwnedBy)
                    .orElse(false);
                if (!owns) {
                    metrics.recordDenial(LedgerOperation.ADD_MONEY_PREPAID.name());
                    throw new ForbiddenException(
                        String.format("User %s does not own prepaid user %s", actor.getUsername(), targetUsername));
                }
            }

            PrepaidUser updated = store.upsertPrepaid(target.addMoney(amountCents));
            metrics.recordTopUp(amountCents);
            log.info("Added {} to prepaid user {} (by {}), moneyAfter={}",
                amountCents, targetUsername, actor.getUsername(), updated.getMoney());
            return updated;
        });
    }

    public PrepaidUser setMoneyPrepaid(LedgerPrincipal actor, String targetUsername, long amountCents) {
        gate(actor, LedgerOperation.SET_MONEY);

        return locked(List.of(KeyedLocks.prepaidKey(targetUsername)), () -> {
            PrepaidUser target = store.getPrepaid(targetUsername);
            PrepaidUser updated = store.upsertPrepaid(target.withMoney(amountCents));
            log.info("Money of prepaid user {} set from {} to {} by {}",
                targetUsername, target.getMoney(), amountCents, actor.getUsername());
            return updated;
        });
    }

    public void deletePrepaidUser(LedgerPrincipal actor, String targetUsername) {
        gate(actor, LedgerOperation.DELETE_PREPAID_USER);

        locked(List.of(KeyedLocks.prepaidKey(targetUsername)), () -> {
            store.deletePrepaid(targetUsername);
            return null;
        });
        log.info("Prepaid user {} deleted by {}", targetUsername, actor.getUsername());
    }

    // ==================== Administration ====================

    /**
     * Settlement: moves money from the administrator's postpaid account to the
     * target's. Both balances change in one unit, so the sum of the two is
     * conserved. Paying up to oneself is a successful no-op.
     *
     * @throws NotFoundException if either postpaid account is absent
     */
    public PayUpResult payUp(LedgerPrincipal actor, String targetUsername, long amountCents) {
        gate(actor, LedgerOperation.PAYUP);
        String payerUsername = actor.getUsername();

        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.TARGET_USER_MDC_KEY, targetUsername);
        try {
            if (payerUsername.equals(targetUsername)) {
                PostpaidUser self = store.getPostpaid(payerUsername);
                log.info("Payup to self is balance neutral, nothing to do");
                return new PayUpResult(self, self, 0L);
            }

            List<String> keys = List.of(KeyedLocks.postpaidKey(payerUsername), KeyedLocks.postpaidKey(targetUsername));
            PayUpResult result = locked(keys, () -> {
                // Read in sorted order so database row locks follow the same order as ours
                PostpaidUser payer;
                PostpaidUser receiver;
                if (payerUsername.compareTo(targetUsername) < 0) {
                    payer = store.getPostpaid(payerUsername);
                    receiver = store.getPostpaid(targetUsername);
                } else {
                    receiver = store.getPostpaid(targetUsername);
                    payer = store.getPostpaid(payerUsername);
                }

                PostpaidUser payerAfter = store.upsertPostpaid(payer.addMoney(-amountCents));
                PostpaidUser receiverAfter = store.upsertPostpaid(receiver.addMoney(amountCents));
                return new PayUpResult(payerAfter, receiverAfter, amountCents);
            });

            metrics.recordPayUp(amountCents);
            log.info("Payup of {} from {} to {}: payerAfter={}, receiverAfter={}",
                amountCents, payerUsername, targetUsername,
                result.getPayer().getMoney(), result.getReceiver().getMoney());
            return result;
        } finally {
            metrics.recordLatency("payup", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.TARGET_USER_MDC_KEY);
        }
    }

    /**
     * Absolute override of a postpaid balance, used for corrections.
     */
    public PostpaidUser setMoneyPostpaid(LedgerPrincipal actor, String targetUsername, long amountCents) {
        gate(actor, LedgerOperation.SET_MONEY);

        return locked(List.of(KeyedLocks.postpaidKey(targetUsername)), () -> {
            PostpaidUser target = store.getPostpaid(targetUsername);
            PostpaidUser updated = store.upsertPostpaid(target.withMoney(amountCents));
            log.info("Money of postpaid user {} set from {} to {} by {}",
                targetUsername, target.getMoney(), amountCents, actor.getUsername());
            return updated;
        });
    }

    /**
     * Flips the activation flag of a postpaid or prepaid user.
     *
     * @return the new activation state
     */
    public boolean toggleActivated(LedgerPrincipal actor, String targetUsername, UserKind kind) {
        gate(actor, LedgerOperation.TOGGLE_ACTIVATED);

        boolean activated = switch (kind) {
            case POSTPAID -> locked(List.of(KeyedLocks.postpaidKey(targetUsername)), () ->
                store.upsertPostpaid(store.getPostpaid(targetUsername).toggleActivated()).isActivated());
            case PREPAID -> locked(List.of(KeyedLocks.prepaidKey(targetUsername)), () ->
                store.upsertPrepaid(store.getPrepaid(targetUsername).toggleActivated()).isActivated());
        };
        log.info("{} user {} is now {} (by {})",
            kind, targetUsername, activated ? "activated" : "deactivated", actor.getUsername());
        return activated;
    }

    public LedgerSnapshot snapshot(LedgerPrincipal actor) {
        gate(actor, LedgerOperation.VIEW_LEDGER);

        return store.inTransaction(() -> new LedgerSnapshot(
            store.listPostpaid(),
            store.listPrepaid(),
            store.listDrinkTypes().stream()
                .sorted(Comparator.comparingLong(DrinkType::getConsumed).reversed())
                .toList()
        ));
    }

    // ==================== Drink catalog ====================

    public List<DrinkType> listDrinkTypes(LedgerPrincipal actor) {
        gate(actor, LedgerOperation.LIST_DRINK_TYPES);
        return store.listDrinkTypes();
    }

    public DrinkType addDrinkType(LedgerPrincipal actor, String name, String icon, int quantity) {
        gate(actor, LedgerOperation.MANAGE_DRINK_TYPES);
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Drink name is required");
        }

        DrinkType created = store.insertDrinkType(name, icon == null ? "" : icon, quantity);
        log.info("Drink type {} ({}) added by {}", created.getId(), name, actor.getUsername());
        return created;
    }

    public DrinkType setDrinkTypeQuantity(LedgerPrincipal actor, int drinkTypeId, int quantity) {
        gate(actor, LedgerOperation.MANAGE_DRINK_TYPES);

        return locked(List.of(KeyedLocks.drinkTypeKey(drinkTypeId)), () -> {
            DrinkType drinkType = store.findDrinkType(drinkTypeId)
                .orElseThrow(() -> new NotFoundException("Drink type not found: " + drinkTypeId));
            return store.updateDrinkType(drinkType.withQuantity(quantity));
        });
    }

    // ==================== Internals ====================

    private void gate(LedgerPrincipal actor, LedgerOperation operation) {
        try {
            policy.check(actor, operation);
        } catch (UnauthorizedException | ForbiddenException e) {
            metrics.recordDenial(operation.name());
            throw e;
        }
    }

    private <T> T locked(List<String> keys, Supplier<T> work) {
        return locks.withLocks(keys, () -> store.inTransaction(work));
    }

    private String freshUserKey() {
        for (int attempt = 0; attempt < USER_KEY_ATTEMPTS; attempt++) {
            String candidate = keyGenerator.nextKey();
            if (!store.isUserKeyTaken(candidate)) {
                return candidate;
            }
            log.debug("Generated user key collided, retrying");
        }
        throw new ConflictException("Could not generate a unique user key");
    }
}
