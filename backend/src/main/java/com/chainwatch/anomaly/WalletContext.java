package com.chainwatch.anomaly;

import com.chainwatch.domain.WalletFirstSeen;
import com.chainwatch.domain.WalletGraphEdge;

import java.math.BigDecimal;

/**
 * Rolling state around a transfer, loaded once before the rules run.
 *
 * @param humanAmount             amount in whole tokens
 * @param senderTransfersInWindow sender's transfers on the chain in the velocity window, this one included
 * @param receiverFirstSeen       receiver's first-seen record, null if none
 * @param reverseEdge             edge receiver -&gt; sender, null if none
 * @param sanctionedFunder        sanctioned address that previously sent to the sender, null if none
 */
public record WalletContext(
        BigDecimal humanAmount,
        long senderTransfersInWindow,
        WalletFirstSeen receiverFirstSeen,
        WalletGraphEdge reverseEdge,
        boolean fromSanctioned,
        boolean toSanctioned,
        String sanctionedFunder
) {
}
