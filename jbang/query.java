///usr/bin/env jbang "$0" "$@" ; exit $?
//JAVA 17
//REPOS central=https://repo1.maven.org/maven2/
//REPOS central-snapshots=https://central.sonatype.com/repository/maven-snapshots/
//DEPS org.springaicommunity:github-provider-cli:1.0.0-SNAPSHOT

import org.springaicommunity.github.provider.cli.GitHubProviderCli;

public class query {
    public static void main(String[] args) throws Exception {
        GitHubProviderCli.main(args);
    }
}
