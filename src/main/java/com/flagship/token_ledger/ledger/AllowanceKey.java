package com.flagship.token_ledger.ledger;

import lombok.NonNull;
import lombok.Value;

/**
 * Key of the allowance map: the amount {@code spender} may move out of {@code owner}'s balance.
 */
@Value(staticConstructor = "of")
public class AllowanceKey {
    @NonNull AccountId owner;
    @NonNull AccountId spender;
}
