package com.slacknotiphier.firehose.domain;

import com.slacknotiphier.firehose.model.EnrichedTransaction;
import java.util.List;

/** Turns the transaction PHIDs of a webhook call into enriched transactions. */
public interface TransactionSource {

  /** Returns the transactions in the order the tracker reports them. */
  List<EnrichedTransaction> getTransactions(
      String objectType, String objectPhid, List<String> transactionPhids);
}
