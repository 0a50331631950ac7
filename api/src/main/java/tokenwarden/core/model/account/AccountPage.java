package tokenwarden.core.model.account;

import java.util.List;

/**
 * One page of accounts plus the total number of matches.
 */
public record AccountPage(List<Account> accounts, long total) {

    public AccountPage {
        accounts = accounts == null ? List.of() : List.copyOf(accounts);
    }
}
