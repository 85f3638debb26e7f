/**
 * Entry points driving the pipeline from outside; currently the command-line batch runner.
 */
package com.phillippitts.scalogram.presentation;
