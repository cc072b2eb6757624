package com.stateset.local.auth.issuer;

import java.io.PrintStream;
import java.time.Clock;

import com.stateset.local.auth.JwtSettingsResolver;
import com.stateset.local.auth.LocalAuthConfigException;
import com.stateset.local.auth.LocalTokenSettings;
import com.stateset.local.auth.MissingSecretException;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Prints a local admin JWT for the API.
 *
 * <p>The secret is looked up in {@code APP__JWT_SECRET}, then {@code JWT_SECRET},
 * then {@code jwt_secret} in {@code config/default.toml}. The lifetime follows
 * the same order with the {@code JWT_EXPIRATION} names and defaults to one hour.
 */
@Slf4j
@AllArgsConstructor
public class DevAdminToken {
    static final int EXIT_OK = 0;
    static final int EXIT_CONFIG_ERROR = 1;

    private final JwtSettingsResolver resolver;
    private final Clock clock;
    private final PrintStream out;
    private final PrintStream err;

    public static void main(String[] args) {
        int status = new DevAdminToken(JwtSettingsResolver.fromEnvironment(), Clock.systemUTC(), System.out, System.err)
            .run();
        System.exit(status);
    }

    public int run() {
        LocalTokenSettings settings;
        try {
            settings = resolver.resolve();
        } catch (MissingSecretException e) {
            err.println(e.getMessage());
            return EXIT_CONFIG_ERROR;
        } catch (LocalAuthConfigException e) {
            log.error("Invalid local configuration", e);
            err.println(e.getMessage());
            return EXIT_CONFIG_ERROR;
        }

        LocalTokenIssuer.Issued issued = new HmacLocalTokenIssuer(settings, clock).issueAdminToken();
        printReport(issued);
        return EXIT_OK;
    }

    private void printReport(LocalTokenIssuer.Issued issued) {
        out.println("Generated admin JWT (valid for " + issued.expiresInSeconds() + " seconds):");
        out.println();
        out.println(issued.token());
        out.println();
        out.println("Use it as:");
        out.println("Authorization: Bearer " + issued.token());
        out.flush();
    }
}
