package com.vidnyan.sixer;

import com.vidnyan.sixer.domain.rule.RewriteSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Default options of a sixer run.
 * Can be configured via application.yml; command-line options take precedence.
 */
@Data
@Component
@ConfigurationProperties(prefix = "sixer")
public class SixerProperties {

    /**
     * Largest xrange span rewritten to range() without importing six.moves.range.
     */
    private int maxRange = RewriteSettings.DEFAULT_MAX_RANGE;

    /**
     * Extra application module names, used to group imports.
     */
    private List<String> applicationModules = new ArrayList<>();

    /**
     * Extra third-party module name prefixes, used to group imports.
     */
    private List<String> thirdPartyModules = new ArrayList<>();

    private boolean quiet;

    /**
     * Print patched content instead of rewriting files. Implies quiet.
     */
    private boolean toStdout;

    /**
     * Where to write the JSON run report; empty for none.
     */
    private String reportPath = "";
}
