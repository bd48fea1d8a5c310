package org.javai.springai.usecases;

import org.javai.springai.usecases.connection.ConnectionProfile;

/**
 * Outcome of a connection profile update.
 */
public sealed interface ProfileUpdateResult {
	record Applied(ConnectionProfile profile) implements ProfileUpdateResult {}
	record Rejected(String reason) implements ProfileUpdateResult {}
}
