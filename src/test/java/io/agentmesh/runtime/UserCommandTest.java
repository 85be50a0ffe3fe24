package io.agentmesh.runtime;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class UserCommandTest {

    @Test
    void parsesTargetedAndCoordinatorMessages() {
        Assertions.assertEquals(new UserCommand("agentB", "wrap it up"), UserCommand.parse("@agentB  wrap it up "));
        Assertions.assertEquals(new UserCommand(null, "wrap it up"), UserCommand.parse("wrap it up"));
        Assertions.assertEquals(new UserCommand("agentC", "line one\nline two"), UserCommand.parse("@agentC line one\nline two"));
    }

    @Test
    void bareMentionIsAMessageAndBlankIsNothing() {
        Assertions.assertEquals(new UserCommand(null, "@agentB"), UserCommand.parse("@agentB"));
        Assertions.assertNull(UserCommand.parse("   "));
        Assertions.assertNull(UserCommand.parse(null));
    }
}
