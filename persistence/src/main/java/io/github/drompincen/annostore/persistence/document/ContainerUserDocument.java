package io.github.drompincen.annostore.persistence.document;

import io.github.drompincen.annostore.protocol.api.Role;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "container_users")
@CompoundIndex(name = "container_user", def = "{'containerName': 1, 'userName': 1}", unique = true)
public class ContainerUserDocument {

    @Id
    private String id;
    private String containerName;
    private String userName;
    private Role role;

    public ContainerUserDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getContainerName() { return containerName; }
    public void setContainerName(String containerName) { this.containerName = containerName; }

    public String getUserName() { return userName; }
    public void setUserName(String userName) { this.userName = userName; }

    public Role getRole() { return role; }
    public void setRole(Role role) { this.role = role; }
}
