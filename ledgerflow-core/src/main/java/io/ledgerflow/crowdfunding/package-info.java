/**
 * Crowdfunding pools that hand off to an escrow when funded.
 */
package io.ledgerflow.crowdfunding;
