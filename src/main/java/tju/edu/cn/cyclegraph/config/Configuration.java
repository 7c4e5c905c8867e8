/*******************************************************************************
 * Copyright (c) 2013 University of Illinois
 * <p/>
 * All rights reserved.
 * <p/>
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are
 * met:
 * <p/>
 * 1. Redistributions of source code must retain the above copyright
 * notice, this list of conditions and the following disclaimer.
 * <p/>
 * 2. Redistributions in binary form must reproduce the above copyright
 * notice, this list of conditions and the following disclaimer in the
 * documentation and/or other materials provided with the distribution.
 * <p/>
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS
 * "AS IS" AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT
 * LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR
 * A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT
 * HOLDER OR CONTRIBUTORS BE LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL,
 * SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT
 * LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE,
 * DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY
 * THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
 * OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 ******************************************************************************/
package tju.edu.cn.cyclegraph.config;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import tju.edu.cn.cyclegraph.CycleCheck;
import tju.edu.cn.cyclegraph.graph.RmwRollbackPolicy;

import java.util.Properties;
import java.util.StringTokenizer;

public class Configuration {

  public final static String opt_script = "script";
  public final static String opt_dot = "dot";
  public final static String opt_rmw_policy = "rmw_policy";
  public final static String opt_init_nodes = "init_nodes";

  public final static String opt_help = "help";

  public final static String default_rmw_policy = "restore";

  public String scriptFile;
  public String dotFile;

  public RmwRollbackPolicy rmwPolicy;
  public int init_nodes;

  private boolean help;

  public Configuration(String[] args) {
    Options options = new Options();

    options.addOption(opt_script, true, "ordering script to replay");
    options.addOption(opt_dot, true, "write the final graph in dot format");
    options.addOption(opt_rmw_policy, true, "restore|legacy");
    options.addOption(opt_init_nodes, true, "initial node table size");
    options.addOption(opt_help, false, "print help info");

    CommandLineParser parser = new DefaultParser();
    CommandLine cmd;
    try {
      cmd = parser.parse(options, args);
    } catch (ParseException e) {
      throw new IllegalArgumentException("Bad command line: " + e.getMessage(), e);
    }

    rmwPolicy = RmwRollbackPolicy.fromString(cmd.getOptionValue(opt_rmw_policy, default_rmw_policy));

    String strInit = cmd.getOptionValue(opt_init_nodes);
    if (strInit != null)
      init_nodes = Integer.parseInt(strInit);
    else
      init_nodes = CycleCheck.INITSZ_L;

    dotFile = cmd.getOptionValue(opt_dot);
    help = cmd.hasOption(opt_help);

    scriptFile = cmd.getOptionValue(opt_script);
    if (scriptFile == null && !cmd.getArgList().isEmpty())
      scriptFile = cmd.getArgList().get(0);
  }

  /**
   * Values from a properties file; a key that is present overrides the command line.
   */
  public void extend(Properties properties) {
    String val = properties.getProperty("script");
    if (val != null && !val.isEmpty())
      scriptFile = val;

    val = properties.getProperty("dot");
    if (val != null && !val.isEmpty())
      dotFile = val;

    val = properties.getProperty("rmw_policy");
    if (val != null && !val.isEmpty())
      rmwPolicy = RmwRollbackPolicy.fromString(val);

    val = properties.getProperty("init_nodes");
    if (val != null && !val.isEmpty())
      init_nodes = Integer.parseInt(val);
  }

  public boolean isHelp() {
    return help;
  }

  public static String getUsage() {
    return "\nGeneral Options:\n"
        + padOpt(" -help", "print this message")
        + padOpt(" -script FILE", "replay the ordering script FILE")
        + padOpt(" -dot FILE", "write the final graph to FILE in dot format")
        + padOpt(" -rmw_policy POLICY", "restore (default) or legacy handling of overwritten rmw links on rollback")
        + padOpt(" -init_nodes SIZE", "set initial node table size to SIZE")
        ;
  }

  protected static String padOpt(String opts, String desc) {
    return pad(opts, desc);
  }

  private static String pad(String opts, String desc) {
    StringBuilder b = new StringBuilder();
    b.append(" ");
    b.append(opts);
    int i;
    if (30 <= opts.length()) {
      b.append("\n");
      i = 0;
    } else i = opts.length() + 1;
    for (; i <= 30; i++) {
      b.append(" ");
    }
    for (StringTokenizer t = new StringTokenizer(desc);
         t.hasMoreTokens(); ) {
      String s = t.nextToken();
      if (i + s.length() > 78) {
        b.append("\n");
        i = 0;
        for (; i <= 30; i++) {
          b.append(" ");
        }
      }
      b.append(s);
      b.append(" ");
      i += s.length() + 1;
    }
    b.append("\n");
    return b.toString();
  }

  @Override
  public String toString() {
    return "Configuration{" +
        "scriptFile='" + scriptFile + '\'' +
        ", dotFile='" + dotFile + '\'' +
        ", rmwPolicy=" + rmwPolicy +
        ", init_nodes=" + init_nodes +
        ", help=" + help +
        '}';
  }
}
