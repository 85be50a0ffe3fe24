package io.agentmesh.host;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

final class LocalSessionDirectoryTest {

    @Test
    void promptRunsResponderAndRecordsTranscript() throws Exception {
        LocalSessionDirectory directory = new LocalSessionDirectory();
        String root = directory.addSession(null, "root");
        String child = directory.createSession(root, "child").orElseThrow();
        directory.respondWith(child, turn -> "reply " + turn.turnNumber() + " to " + turn.prompt());

        directory.prompt(child, "hello", Duration.ofSeconds(5));
        directory.note(child, "fyi");

        Assertions.assertEquals(List.of("hello"), directory.prompts(child));
        Assertions.assertEquals(List.of("fyi"), directory.notes(child));
        Assertions.assertEquals(List.of(child), directory.children(root));
        Assertions.assertEquals(root, directory.parentOf(child).orElseThrow());
        List<HostMessage> messages = directory.messages(child);
        Assertions.assertEquals(3, messages.size());
        Assertions.assertEquals("reply 1 to hello", messages.get(1).parts().get(0).text());
        Assertions.assertTrue(messages.get(1).fromAssistant());
    }

    @Test
    void failuresSurfaceAsHostExceptions() {
        LocalSessionDirectory directory = new LocalSessionDirectory();
        String root = directory.addSession(null, "root");
        directory.failPrompts(root, true);

        Assertions.assertThrows(HostException.class, () -> directory.prompt(root, "x", null));
        Assertions.assertThrows(HostException.class, () -> directory.note("ses_none", "x"));
        Assertions.assertThrows(HostException.class, () -> directory.createSession("ses_none", "x"));

        directory.failCreate(true);
        Assertions.assertDoesNotThrow(() -> Assertions.assertTrue(directory.createSession(root, "x").isEmpty()));
    }
}
