package work.vaultlogic.sandbox.cli;

import picocli.CommandLine;

// version comes from the jar manifest; running from classes reports "development"
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        Package pkg = Main.class.getPackage();
        String version = pkg.getImplementationVersion() == null ? "development" : pkg.getImplementationVersion();
        return new String[] {
            "sandbox-run " + version,
            "JVM " + System.getProperty("java.vm.name", "unknown") + " " + Runtime.version()
        };
    }
}
