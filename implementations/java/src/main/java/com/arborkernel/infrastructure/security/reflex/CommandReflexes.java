package com.arborkernel.infrastructure.security.reflex;

import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Built-in reflexes screening shell commands before an agent runs them.
 *
 * <p>Each group is a set of patterns; a command matching any pattern of a group
 * fails that group's reflex.
 */
@Slf4j
public class CommandReflexes {

    public static final String DESTRUCTIVE = "destructive_command";
    public static final String PRIVILEGE_ESCALATION = "privilege_escalation";
    public static final String RAW_NETWORK = "raw_network";

    private static final Map<String, List<Pattern>> GROUPS = new LinkedHashMap<>();

    static {
        GROUPS.put(DESTRUCTIVE, List.of(
            Pattern.compile("\\brm\\s+(-[a-zA-Z]*[rf][a-zA-Z]*\\s+)+(/|~|\\*|\\$HOME)(\\s|$)"),
            Pattern.compile("\\bmkfs(\\.\\w+)?\\b"),
            Pattern.compile("\\bdd\\s+[^|;&]*\\bof=/dev/"),
            Pattern.compile(":\\(\\)\\s*\\{\\s*:\\|:&\\s*\\};:"),
            Pattern.compile(">\\s*/dev/sd[a-z]"),
            Pattern.compile("\\bshred\\b"),
            Pattern.compile("(?i)\\b(drop\\s+(database|table)|truncate\\s+table)\\b"),
            Pattern.compile("\\bgit\\s+push\\s+[^|;&]*(--force|-f)\\b")
        ));
        GROUPS.put(PRIVILEGE_ESCALATION, List.of(
            Pattern.compile("(^|[;&|]\\s*|\\s)sudo\\b"),
            Pattern.compile("(^|[;&|]\\s*|\\s)su(\\s+-|\\s+root|\\s*$)"),
            Pattern.compile("\\bchmod\\s+([ugoa]*\\+s|[0-7]*4[0-7]{3})\\b"),
            Pattern.compile("\\bchown\\s+[^|;&]*\\broot\\b"),
            Pattern.compile("/etc/(sudoers|shadow|passwd)\\b"),
            Pattern.compile("\\b(setcap|doas|pkexec)\\b")
        ));
        GROUPS.put(RAW_NETWORK, List.of(
            Pattern.compile("\\b(nc|ncat|netcat|socat|telnet)\\b"),
            Pattern.compile("/dev/(tcp|udp)/"),
            Pattern.compile("\\b(nmap|masscan|tcpdump)\\b"),
            Pattern.compile("\\b(curl|wget)\\b[^|;&]*\\|\\s*(ba|z)?sh\\b")
        ));
    }

    private final ReflexGuard guard;

    public CommandReflexes(ReflexGuard guard) {
        this.guard = guard;
    }

    public static List<String> names() {
        return List.copyOf(GROUPS.keySet());
    }

    /**
     * Evaluate every group against the command.
     *
     * @return results in group order
     */
    public List<ReflexResult> evaluate(String command) {
        List<ReflexResult> results = new ArrayList<>(GROUPS.size());
        for (Map.Entry<String, List<Pattern>> group : GROUPS.entrySet()) {
            results.add(guard.wrap(group.getKey(), () -> !matchesAny(group.getValue(), command)));
        }
        return results;
    }

    /**
     * First refusing reflex, if any.
     */
    public Optional<ReflexResult> firstBlocking(String command) {
        for (ReflexResult result : evaluate(command)) {
            if (!result.isAllowed()) {
                log.warn("Command blocked by reflex {}: {}", result.getName(), Encode.forJava(command));
                return Optional.of(result);
            }
        }
        return Optional.empty();
    }

    private static boolean matchesAny(List<Pattern> patterns, String command) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(command).find()) {
                return true;
            }
        }
        return false;
    }
}
