package com.awsmap.inventory;

/**
 * Resolves the account the current credentials belong to. A failure here is fatal to the run.
 */
@FunctionalInterface
public interface AccountIdentitySource {

    String currentAccountId();
}
