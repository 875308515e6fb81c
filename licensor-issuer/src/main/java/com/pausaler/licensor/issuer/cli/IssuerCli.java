package com.pausaler.licensor.issuer.cli;

import com.pausaler.licensor.exceptions.ActivationCodeException;
import com.pausaler.licensor.issuer.LicenseIssuer;
import com.pausaler.licensor.issuer.config.IssuerConfig;
import com.pausaler.licensor.model.LicenseType;
import java.io.PrintStream;
import java.time.Clock;
import java.util.Map;

/**
 * Command-line license issuer.
 *
 * <pre>
 * Usage:
 *   mvn -q -pl licensor-issuer exec:java -Dexec.args="generate --activation-code &lt;code&gt; --type &lt;yearly|lifetime&gt;"
 *   mvn -q -pl licensor-issuer exec:java -Dexec.args="public-key"
 * </pre>
 *
 * <p>{@code generate} prints the license string on standard output; {@code public-key} prints the SPKI PEM
 * to embed in the application build. Any failure prints a message on standard error and exits with 1.
 * The signing seed comes from {@code LICENSOR_SIGNING_SEED_HEX}, see {@link IssuerConfig}.
 */
public class IssuerCli {

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;

  private final Map<String, String> env;
  private final Clock clock;

  public IssuerCli(final Map<String, String> env, final Clock clock) {
    this.env = env;
    this.clock = clock;
  }

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    System.exit(new IssuerCli(System.getenv(), Clock.systemUTC()).run(args, System.out, System.err));
  }

  /**
   * Runs one command.
   *
   * @param args command-line arguments
   * @param out  receives the command's result
   * @param err  receives usage and error messages
   * @return the process exit status
   */
  public int run(String[] args, PrintStream out, PrintStream err) {
    if (args.length == 0) {
      usage(err);
      return EXIT_FAILURE;
    }
    try {
      return switch (args[0]) {
        case "generate" -> generate(args, out, err);
        case "public-key" -> publicKey(out);
        default -> {
          err.println("Unknown command: " + args[0]);
          usage(err);
          yield EXIT_FAILURE;
        }
      };
    } catch (ActivationCodeException | IllegalArgumentException e) {
      err.println("Error: " + e.getMessage());
      return EXIT_FAILURE;
    }
  }

  private int generate(String[] args, PrintStream out, PrintStream err) {
    String activationCode = null;
    String type = null;

    for (int i = 1; i < args.length; i++) {
      String arg = args[i];
      if (arg.startsWith("--activation-code=")) {
        activationCode = arg.substring("--activation-code=".length());
      } else if ("--activation-code".equals(arg) && i + 1 < args.length) {
        activationCode = args[++i];
      } else if (arg.startsWith("--type=")) {
        type = arg.substring("--type=".length());
      } else if ("--type".equals(arg) && i + 1 < args.length) {
        type = args[++i];
      } else {
        err.println("Unexpected argument: " + arg);
        usage(err);
        return EXIT_FAILURE;
      }
    }

    if (activationCode == null || type == null) {
      usage(err);
      return EXIT_FAILURE;
    }

    LicenseType licenseType = LicenseType.fromName(type);
    out.println(issuer().issue(activationCode, licenseType));
    return EXIT_OK;
  }

  private int publicKey(PrintStream out) {
    out.print(issuer().publicKeyPem());
    return EXIT_OK;
  }

  private LicenseIssuer issuer() {
    return new LicenseIssuer(IssuerConfig.fromEnvironment(env), clock);
  }

  private static void usage(PrintStream err) {
    err.println("Usage: IssuerCli <command>");
    err.println();
    err.println("  generate --activation-code <code> --type <yearly|lifetime>");
    err.println("      Issue a license for an activation code and print it.");
    err.println("  public-key");
    err.println("      Print the issuer public key (SPKI PEM).");
    err.println();
    err.println("Environment:");
    err.println("  " + IssuerConfig.SEED_ENV + "   hex-encoded 32-byte signing seed (default: development seed)");
  }
}
