/**
 * ValidRun source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.validrun.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.validrun.cli.ValidRunCommand} maps commands to engine APIs.</li>
 *   <li>{@code io.validrun.runtime.RunEngine} validates a request, walks the tree and resumes suspended runs.</li>
 *   <li>{@code io.validrun.runner.CaseRunner} executes one case and writes its authoritative result.</li>
 * </ul>
 */
package io.validrun;
