package com.cronium.engine.model;

import com.cronium.sandbox.SandboxTypes.RemoteTarget;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Remote host an event can run on.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Server {
    private Long id;
    private String name;
    private String address;
    @Builder.Default
    private int port = 22;
    private String username;
    private String sshKeyPath;

    public RemoteTarget toTarget() {
        return RemoteTarget.builder()
                .id(id)
                .name(name)
                .address(address)
                .port(port)
                .username(username)
                .sshKeyPath(sshKeyPath)
                .build();
    }
}
