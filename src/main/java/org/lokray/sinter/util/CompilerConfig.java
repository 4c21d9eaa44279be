// File: src/main/java/org/lokray/sinter/util/CompilerConfig.java
package org.lokray.sinter.util;

import java.util.Properties;

/**
 * Holds configuration settings for the Sinter compiler, loaded from a properties file.
 * Provides sensible defaults if settings are not specified.
 */
public class CompilerConfig
{
	private final String moduleName;
	private final String targetTriple;
	private final boolean verifyModule;
	private final boolean echoDiagnostics;
	private final boolean debugEnabled;

	public CompilerConfig()
	{
		this(new Properties());
	}

	public CompilerConfig(Properties props)
	{
		this.moduleName = props.getProperty("codegen.module_name", "sinter_module");
		this.targetTriple = props.getProperty("codegen.target_triple", "").trim();
		this.verifyModule = Boolean.parseBoolean(props.getProperty("backend.verify", "true"));
		this.echoDiagnostics = Boolean.parseBoolean(props.getProperty("diagnostics.echo", "true"));
		this.debugEnabled = Boolean.parseBoolean(props.getProperty("debug.enabled", "false"));
	}

	public String getModuleName()
	{
		return moduleName;
	}

	/**
	 * @return The target triple to stamp on emitted modules, or an empty string to leave it to the backend.
	 */
	public String getTargetTriple()
	{
		return targetTriple;
	}

	public boolean isVerifyModule()
	{
		return verifyModule;
	}

	public boolean isEchoDiagnostics()
	{
		return echoDiagnostics;
	}

	public boolean isDebugEnabled()
	{
		return debugEnabled;
	}
}
