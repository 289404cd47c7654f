package me.go_gradually.soundrelay.infrastructure.extraction;

import me.go_gradually.soundrelay.infrastructure.shared.config.AppProperties;

import java.util.ArrayList;
import java.util.List;

final class YtDlpCommand {
    private YtDlpCommand() {
    }

    static List<String> streamToStdout(AppProperties.YtDlp config, String url) {
        List<String> cmd = base(config);
        cmd.addAll(List.of("-f", "bestaudio/best", "-o", "-"));
        cmd.add(url);
        return cmd;
    }

    static List<String> resolveUrl(AppProperties.YtDlp config, String url) {
        List<String> cmd = base(config);
        cmd.addAll(List.of("-f", "bestaudio/best", "--get-url"));
        cmd.add(url);
        return cmd;
    }

    private static List<String> base(AppProperties.YtDlp config) {
        List<String> cmd = new ArrayList<>();
        cmd.add(config.getExecutable());
        cmd.add("--no-warnings");
        cmd.add("--no-playlist");
        cmd.add("--quiet");
        if (config.getCookiesFile() != null && !config.getCookiesFile().isBlank()) {
            cmd.add("--cookies");
            cmd.add(config.getCookiesFile());
        }
        return cmd;
    }
}
