package io.ledgerflow.anchor;

import io.ledgerflow.InvalidParamsException;
import io.ledgerflow.util.FlatJson;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Destination bank account for a withdrawal.
 */
public record BankAccount(String accountNumber, String routingNumber, AccountType accountType, String bankName) {
  public enum AccountType { CHECKING, SAVINGS }

  public BankAccount {
    if (accountNumber == null || accountNumber.isBlank() || routingNumber == null || routingNumber.isBlank()) {
      throw new InvalidParamsException("Bank account number and routing number are required");
    }
    if (accountType == null) {
      accountType = AccountType.CHECKING;
    }
  }

  String destExtra() {
    Map<String, String> extra = new LinkedHashMap<>();
    extra.put("routing_number", routingNumber);
    extra.put("account_type", accountType.name().toLowerCase(Locale.ROOT));
    return FlatJson.write(extra);
  }

  @Override
  public String toString() {
    String tail = accountNumber.length() > 4 ? accountNumber.substring(accountNumber.length() - 4) : accountNumber;
    return "BankAccount[****" + tail + ", " + accountType + (bankName == null ? "" : ", " + bankName) + "]";
  }
}
