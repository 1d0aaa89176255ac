package com.cronium.engine.store;

import com.cronium.channel.ToolCredential;

import java.util.Optional;

public interface CredentialStore {

    Optional<ToolCredential> getCredential(long toolId);

    ToolCredential saveCredential(ToolCredential credential);
}
